package io.hostforge.provisioner.config;

import io.hostforge.provisioner.step.StepRegistry;
import io.hostforge.provisioner.step.hardening.ApplySshHardeningStep;
import io.hostforge.provisioner.step.hardening.ConfigureFirewallStep;
import io.hostforge.provisioner.step.hardening.ConfigureIntrusionPreventionStep;
import io.hostforge.provisioner.step.hardening.CreateDeploymentUserStep;
import io.hostforge.provisioner.step.hardening.DeployPublicKeyStep;
import io.hostforge.provisioner.step.hardening.EnableAutoUpdatesStep;
import io.hostforge.provisioner.step.hardening.GenerateKeyPairStep;
import io.hostforge.provisioner.step.hardening.HardeningContext;
import io.hostforge.provisioner.step.wizard.ApplicationStep;
import io.hostforge.provisioner.step.wizard.CredentialsStep;
import io.hostforge.provisioner.step.wizard.DeploymentStep;
import io.hostforge.provisioner.step.wizard.DnsConfigStep;
import io.hostforge.provisioner.step.wizard.InfrastructureStep;
import io.hostforge.provisioner.step.wizard.ProjectConfigStep;
import io.hostforge.provisioner.step.wizard.SecurityStep;
import io.hostforge.provisioner.step.wizard.SslConfigStep;
import io.hostforge.provisioner.step.wizard.ValidationStep;
import io.hostforge.provisioner.step.wizard.WelcomeStep;
import io.hostforge.provisioner.step.wizard.WizardContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * The two workflows. Order is spelled out here, not derived from bean
 * discovery order.
 */
@Configuration
public class WorkflowConfig {

    @Bean
    public StepRegistry<HardeningContext> hardeningWorkflow(
            GenerateKeyPairStep generateKeyPair,
            DeployPublicKeyStep deployPublicKey,
            CreateDeploymentUserStep createDeploymentUser,
            ApplySshHardeningStep applySshHardening,
            ConfigureFirewallStep configureFirewall,
            ConfigureIntrusionPreventionStep configureIntrusionPrevention,
            EnableAutoUpdatesStep enableAutoUpdates) {
        return new StepRegistry<>("security-hardening", List.of(
                generateKeyPair,
                deployPublicKey,
                createDeploymentUser,
                applySshHardening,
                configureFirewall,
                configureIntrusionPrevention,
                enableAutoUpdates));
    }

    @Bean
    public StepRegistry<WizardContext> wizardWorkflow(
            WelcomeStep welcome,
            CredentialsStep credentials,
            ProjectConfigStep projectConfig,
            InfrastructureStep infrastructure,
            DnsConfigStep dnsConfig,
            SslConfigStep sslConfig,
            SecurityStep security,
            ApplicationStep application,
            ValidationStep validation,
            DeploymentStep deployment) {
        return new StepRegistry<>("setup-wizard", List.of(
                welcome,
                credentials,
                projectConfig,
                infrastructure,
                dnsConfig,
                sslConfig,
                security,
                application,
                validation,
                deployment));
    }
}
