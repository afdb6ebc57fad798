package io.hostforge.provisioner.step.wizard;

/** Wizard step names, in run order. */
public final class WizardStepNames {

    public static final String WELCOME        = "welcome";
    public static final String CREDENTIALS    = "credentials";
    public static final String PROJECT_CONFIG = "project-config";
    public static final String INFRASTRUCTURE = "infrastructure";
    public static final String DNS_CONFIG     = "dns-config";
    public static final String SSL_CONFIG     = "ssl-config";
    public static final String SECURITY       = "security";
    public static final String APPLICATION    = "application";
    public static final String VALIDATION     = "validation";
    public static final String DEPLOYMENT     = "deployment";

    private WizardStepNames() {}
}
