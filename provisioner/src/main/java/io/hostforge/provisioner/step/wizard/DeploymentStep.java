package io.hostforge.provisioner.step.wizard;

import io.hostforge.provisioner.config.SshSettings;
import io.hostforge.provisioner.connection.LockoutException;
import io.hostforge.provisioner.integration.CertificateClient;
import io.hostforge.provisioner.integration.CertificateResult;
import io.hostforge.provisioner.integration.CloudResource;
import io.hostforge.provisioner.integration.CloudResourceClient;
import io.hostforge.provisioner.integration.DnsClient;
import io.hostforge.provisioner.integration.DnsRecord;
import io.hostforge.provisioner.model.FailureKind;
import io.hostforge.provisioner.model.WorkflowResult;
import io.hostforge.provisioner.service.SecurityHardeningService;
import io.hostforge.provisioner.service.SecurityHardeningService.HardeningRequest;
import io.hostforge.provisioner.step.Step;
import io.hostforge.provisioner.step.StepException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Creates the host, hardens it, then points DNS at it and requests certificates.
 *
 * Hardening runs as its own workflow with its own state document, so a
 * retried deployment picks up hardening where it stopped.
 */
@Component
public class DeploymentStep implements Step<WizardContext> {

    private static final Logger log = LoggerFactory.getLogger(DeploymentStep.class);

    private final CloudResourceClient      cloud;
    private final DnsClient                dns;
    private final CertificateClient        certificates;
    private final SecurityHardeningService hardening;
    private final SshSettings              ssh;

    public DeploymentStep(CloudResourceClient cloud, DnsClient dns, CertificateClient certificates,
                          SecurityHardeningService hardening, SshSettings ssh) {
        this.cloud        = cloud;
        this.dns          = dns;
        this.certificates = certificates;
        this.hardening    = hardening;
        this.ssh          = ssh;
    }

    @Override public String  name()        { return WizardStepNames.DEPLOYMENT; }
    @Override public String  description() { return "Deploy"; }
    @Override public boolean isCritical()  { return true; }

    @Override
    public Map<String, Object> run(WizardContext ctx) throws InterruptedException {
        Map<String, Object> infrastructure = ctx.result(WizardStepNames.INFRASTRUCTURE);
        String instanceName = (String) infrastructure.get("instanceName");
        if (instanceName == null) {
            throw new StepException(FailureKind.CONFIGURATION, "No infrastructure plan recorded",
                    "Start a new session; the infrastructure step must not be skipped.");
        }
        String os = (String) infrastructure.get("operatingSystem");

        Map<String, String> properties = new LinkedHashMap<>();
        properties.put("instanceType", String.valueOf(infrastructure.get("instanceType")));
        properties.put("operatingSystem", String.valueOf(os));
        CloudResource instance = cloud.create(instanceName, "compute-instance", properties, ctx.dryRun());

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("instanceName", instance.name());
        data.put("address", instance.address());
        data.put("simulated", instance.simulated());

        if (ctx.dryRun()) {
            data.put("hardeningPlan", hardening.plan());
        } else {
            harden(instance, os);
            data.put("hardening", "completed");
        }

        Map<String, Object> dnsConfig = ctx.result(WizardStepNames.DNS_CONFIG);
        List<String> accessUrls = new ArrayList<>();
        if (Boolean.TRUE.equals(dnsConfig.get("enabled"))) {
            @SuppressWarnings("unchecked")
            List<String> subdomains = (List<String>) dnsConfig.getOrDefault("subdomains", List.of());
            String primary = (String) dnsConfig.get("primaryDomain");
            List<DnsRecord> records = dns.upsertRecords(primary, subdomains, instance.address(), ctx.dryRun());
            data.put("dnsRecords", records.stream().map(r -> r.name() + " " + r.type() + " " + r.value()
                    + " (" + r.status() + ")").toList());
            records.forEach(r -> accessUrls.add("https://" + r.name()));
        } else {
            accessUrls.add("http://" + instance.address());
        }

        Map<String, Object> sslConfig = ctx.result(WizardStepNames.SSL_CONFIG);
        if (Boolean.TRUE.equals(sslConfig.get("enabled"))) {
            @SuppressWarnings("unchecked")
            List<String> domains = (List<String>) sslConfig.get("domains");
            CertificateResult certificate = certificates.requestCertificate(domains,
                    (String) sslConfig.get("email"), (String) sslConfig.get("challengeType"), ctx.dryRun());
            data.put("certificate", certificate.status());
        }
        data.put("accessUrls", accessUrls);
        return data;
    }

    private void harden(CloudResource instance, String os) throws InterruptedException {
        String keyPath = instance.properties().get("privateKeyPath");
        Path initialKey = keyPath != null ? Path.of(keyPath)
                : ssh.keyDirectory().resolve(instance.name() + ".pem");
        WorkflowResult result = hardening.harden(
                new HardeningRequest(instance.name(), instance.address(), initialKey, os));
        log.info("Hardening of {} ended: {}", instance.name(), result.status());

        switch (result.status()) {
            case COMPLETED -> { }
            case LOCKED_OUT -> throw LockoutException.reported(instance.address(), result.message());
            case INTERRUPTED -> throw new InterruptedException(result.message());
            case SAVED_AND_EXITED, CANCELLED -> throw new StepException(FailureKind.TRANSIENT,
                    "Security hardening stopped at '" + result.stepName() + "'",
                    "Retry this step, or finish hardening with: " + result.resumeHint());
        }
    }
}
