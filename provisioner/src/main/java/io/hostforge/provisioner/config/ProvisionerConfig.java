package io.hostforge.provisioner.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

/**
 * Binds the {@code hostforge.*} settings from application.yml into typed records.
 *
 * Every component takes the record it needs through its constructor, so unit
 * tests build the same records by hand without a Spring context.
 */
@Configuration
public class ProvisionerConfig {

    @Bean
    public HardeningTarget hardeningTarget(
            @Value("${hostforge.ssh.default-port:22}") int defaultPort,
            @Value("${hostforge.ssh.target-port:2847}") int targetPort,
            @Value("${hostforge.ssh.original-username:}") String originalUsername,
            @Value("${hostforge.host.operating-system:ubuntu}") String operatingSystem,
            @Value("${hostforge.ssh.deployment-username:deploy}") String deploymentUsername,
            @Value("${hostforge.ssh.key-auth-only:true}") boolean keyAuthOnly) {
        // An explicit username wins; otherwise derive it from the image's OS.
        String original = originalUsername.isBlank()
                ? OperatingSystem.parse(operatingSystem).defaultUsername()
                : originalUsername;
        return new HardeningTarget(defaultPort, targetPort, original, deploymentUsername, keyAuthOnly);
    }

    @Bean
    public RecoveryPolicy recoveryPolicy(
            @Value("${hostforge.recovery.max-attempts:3}") int maxAttempts,
            @Value("${hostforge.recovery.retry-delay:1s}") Duration retryDelay) {
        return new RecoveryPolicy(maxAttempts, retryDelay);
    }

    @Bean
    public SshSettings sshSettings(
            @Value("${hostforge.ssh.connect-timeout:15s}") Duration connectTimeout,
            @Value("${hostforge.ssh.command-timeout:300s}") Duration commandTimeout,
            @Value("${hostforge.ssh.key-directory:${user.home}/.ssh}") Path keyDirectory,
            @Value("${hostforge.ssh.key-type:rsa}") String keyType,
            @Value("${hostforge.ssh.key-size:4096}") int keySize) {
        return new SshSettings(connectTimeout, commandTimeout, keyDirectory, keyType, keySize);
    }

    @Bean
    public FirewallPolicy firewallPolicy(
            @Value("${hostforge.firewall.allowed-ports:80,443}") List<Integer> allowedPorts) {
        return new FirewallPolicy(allowedPorts);
    }

    @Bean
    public IntrusionPreventionPolicy intrusionPreventionPolicy(
            @Value("${hostforge.intrusion-prevention.ban-time:3600}") int banTime,
            @Value("${hostforge.intrusion-prevention.find-time:600}") int findTime,
            @Value("${hostforge.intrusion-prevention.max-retry:5}") int maxRetry,
            @Value("${hostforge.intrusion-prevention.ignore-ips:127.0.0.1/8,::1}") List<String> ignoreIps) {
        return new IntrusionPreventionPolicy(banTime, findTime, maxRetry, ignoreIps);
    }

    @Bean
    public WizardSettings wizardSettings(
            @Value("${hostforge.wizard.instance-type:t3.micro}") String instanceType,
            @Value("${hostforge.host.operating-system:ubuntu}") String operatingSystem,
            @Value("${hostforge.wizard.domain:}") String domain,
            @Value("${hostforge.wizard.subdomains:}") List<String> subdomains,
            @Value("${hostforge.wizard.certificate-email:}") String certificateEmail,
            @Value("${hostforge.wizard.challenge-type:http-01}") String challengeType,
            @Value("${hostforge.wizard.application-type:nodejs}") String applicationType,
            @Value("${hostforge.wizard.application-port:3000}") int applicationPort) {
        return new WizardSettings(instanceType, operatingSystem, domain, subdomains,
                certificateEmail, challengeType, applicationType, applicationPort);
    }

    /**
     * The mapper used for every state document. Indented so the files stay
     * readable when an operator opens them during a post-mortem.
     */
    @Bean
    @Primary
    public ObjectMapper objectMapper() {
        return newObjectMapper();
    }

    /** No actuator in a CLI; a simple in-memory registry is enough for the step summary. */
    @Bean
    @ConditionalOnMissingBean
    public MeterRegistry meterRegistry() {
        return new SimpleMeterRegistry();
    }

    public static ObjectMapper newObjectMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .enable(SerializationFeature.INDENT_OUTPUT)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }
}
