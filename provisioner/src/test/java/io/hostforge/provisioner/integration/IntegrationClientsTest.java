package io.hostforge.provisioner.integration;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.hostforge.provisioner.config.ConfigurationException;
import io.hostforge.provisioner.config.ProvisionerConfig;
import io.hostforge.provisioner.repository.JsonDocumentStore;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.mock.env.MockEnvironment;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/** The local collaborator implementations used when no provider API is configured. */
class IntegrationClientsTest {

    // ------------------------------------------------------------------
    // Cloud
    // ------------------------------------------------------------------

    @Test
    void cloud_dryRun_returnsSimulatedResourceOfSameShape() {
        CloudResource resource = new StaticInventoryCloudClient("", "")
                .create("shop-server", "compute-instance", Map.of("instanceType", "t3.micro"), true);

        assertThat(resource.simulated()).isTrue();
        assertThat(resource.name()).isEqualTo("shop-server");
        assertThat(resource.properties()).containsEntry("instanceType", "t3.micro");
    }

    @Test
    void cloud_withoutHostAddress_onlySupportsDryRun() {
        StaticInventoryCloudClient client = new StaticInventoryCloudClient("", "");

        assertThatThrownBy(() -> client.create("shop-server", "compute-instance", Map.of(), false))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("shop-server");
        assertThat(client.describe("shop-server", false)).isEmpty();
    }

    @Test
    void cloud_existingHost_isResolvedWithItsKey() {
        StaticInventoryCloudClient client = new StaticInventoryCloudClient("198.51.100.7", "/keys/provider.pem");

        CloudResource resource = client.create("shop-server", "compute-instance", Map.of(), false);

        assertThat(resource.address()).isEqualTo("198.51.100.7");
        assertThat(resource.simulated()).isFalse();
        assertThat(resource.properties()).containsEntry("privateKeyPath", "/keys/provider.pem");
        assertThat(client.describe("shop-server", false)).get()
                .extracting(CloudResource::status).isEqualTo("running");
        client.delete("shop-server", false);
        assertThat(client.describe("shop-server", false)).isPresent();
    }

    // ------------------------------------------------------------------
    // Credentials
    // ------------------------------------------------------------------

    @Test
    void credentials_missingKeys_areReportedTogether() {
        MockEnvironment env = new MockEnvironment();

        assertThatThrownBy(() -> new EnvironmentCredentialCollector(env).collect(false))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("hostforge.credentials.region")
                .hasMessageContaining("hostforge.credentials.access-key-id")
                .hasMessageContaining("hostforge.credentials.secret-access-key");
    }

    @Test
    void credentials_dryRun_needsOnlyRegion() {
        MockEnvironment env = new MockEnvironment().withProperty("hostforge.credentials.region", "eu-west-1");

        Credentials credentials = new EnvironmentCredentialCollector(env).collect(true);

        assertThat(credentials.region()).isEqualTo("eu-west-1");
        assertThat(credentials.cloudProvider()).isEqualTo("aws");
        assertThat(credentials.dnsProvider()).isEqualTo("manual");
    }

    @Test
    void credentialsSummary_neverContainsSecrets() {
        Credentials credentials = new Credentials("aws", "AKIAEXAMPLE1234", "s3cr3t", "eu-west-1",
                "route53", "dns-token", null);

        Map<String, Object> summary = credentials.summary();

        assertThat(summary)
                .containsEntry("accessKeyId", "****1234")
                .containsEntry("dnsToken", true)
                .containsEntry("gitToken", false)
                .doesNotContainKey("secretAccessKey");
        assertThat(summary.values()).doesNotContain("s3cr3t", "dns-token");
        assertThat(Credentials.mask("abc")).isEqualTo("****");
    }

    // ------------------------------------------------------------------
    // DNS, certificates, scaffolding
    // ------------------------------------------------------------------

    @Test
    void manualDns_listsOneRecordPerName() {
        List<DnsRecord> records = new ManualDnsClient()
                .upsertRecords("shop.example", List.of("www", "api"), "198.51.100.7", false);

        assertThat(records).extracting(DnsRecord::name)
                .containsExactly("shop.example", "www.shop.example", "api.shop.example");
        assertThat(records).allSatisfy(r -> {
            assertThat(r.type()).isEqualTo("A");
            assertThat(r.status()).isEqualTo("manual");
        });
    }

    @Test
    void manualCertificate_statusFollowsDryRun() {
        ManualCertificateClient client = new ManualCertificateClient();

        assertThat(client.requestCertificate(List.of("shop.example"), "ops@shop.example", "http-01", true)
                .status()).isEqualTo("simulated");
        assertThat(client.requestCertificate(List.of("shop.example"), "ops@shop.example", "http-01", false)
                .status()).isEqualTo("manual");
    }

    @Test
    void scaffolder_writesConfigOnlyOutsideDryRun(@TempDir Path projectPath) throws Exception {
        ObjectMapper mapper = ProvisionerConfig.newObjectMapper();
        DirectoryProjectScaffolder scaffolder = new DirectoryProjectScaffolder(new JsonDocumentStore(mapper));

        Path planned = scaffolder.scaffold("shop", projectPath, Map.of("setupMode", "QUICK"), true);
        assertThat(planned).doesNotExist();

        Path written = scaffolder.scaffold("shop", projectPath, Map.of("setupMode", "QUICK"), false);
        JsonNode config = mapper.readTree(written.toFile());
        assertThat(config.get("project").asText()).isEqualTo("shop");
        assertThat(config.get("setupMode").asText()).isEqualTo("QUICK");
    }
}
