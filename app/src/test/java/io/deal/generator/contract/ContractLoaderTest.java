package io.deal.generator.contract;

import io.deal.generator.TestSchemas;
import io.deal.generator.exceptions.MalformedContractException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ContractLoaderTest {

    @TempDir
    Path tempDir;

    private ContractLoader loader;

    @BeforeEach
    void setUp() {
        loader = new ContractLoader();
    }

    @Test
    @DisplayName("Should load services, methods and cases in document order")
    void shouldLoadContract() {
        Contract contract = TestSchemas.contract("catalog_contract.json");

        assertThat(contract.name()).isEqualTo("catalog-contract");
        assertThat(contract.services()).containsOnlyKeys("CatalogService");

        MethodContract getItem = contract.service("CatalogService").orElseThrow().method("GetItem");
        assertThat(getItem.successCases()).extracting(SuccessCase::description)
            .containsExactly("book with attributes", null);
        assertThat(getItem.failureCases()).extracting(FailureCase::description)
            .containsExactly("missing item", "forbidden item");
        assertThat(getItem.caseCount()).isEqualTo(4);
        assertThat(getItem.successCases().get(0).response().get("tags").size()).isEqualTo(2);
    }

    @Test
    @DisplayName("Should accept errorCode as an alias of the error code")
    void shouldAcceptErrorCodeAlias() {
        Contract contract = TestSchemas.contract("catalog_contract.json");

        FailureCase missing = contract.service("CatalogService").orElseThrow()
            .method("GetItem").failureCases().get(0);

        assertThat(missing.error().code()).isEqualTo("NotFound");
        assertThat(missing.error().message()).isEqualTo("item missing not found");
    }

    @Test
    @DisplayName("Should treat methods absent from the contract as empty")
    void shouldTreatAbsentMethodsAsEmpty() {
        Contract contract = TestSchemas.contract("catalog_contract.json");

        MethodContract ping = contract.service("CatalogService").orElseThrow().method("Ping");

        assertThat(ping.isEmpty()).isTrue();
        assertThat(contract.service("AuditService")).isEmpty();
    }

    @Test
    @DisplayName("Should load contract from a file")
    void shouldLoadFromFile() throws Exception {
        Path file = tempDir.resolve("contract.json");
        Files.writeString(file, "{\"name\": \"file\", \"services\": {\"MyService\": {}}}");

        Contract contract = loader.load(file);

        assertThat(contract.name()).isEqualTo("file");
        assertThat(contract.service("MyService")).hasValueSatisfying(
            service -> assertThat(service.methods()).isEmpty());
    }

    @Test
    @DisplayName("Should reject syntactically invalid JSON")
    void shouldRejectInvalidJson() {
        assertThatThrownBy(() -> load("{\"name\": \"broken\", \"services\": {"))
            .isInstanceOf(MalformedContractException.class)
            .hasMessageContaining("inline is not a valid contract");
    }

    @Test
    @DisplayName("Should reject a contract of the wrong shape")
    void shouldRejectWrongShape() {
        assertThatThrownBy(() -> load("{\"services\": {\"MyService\": {\"MyMethod\": {\"successCases\": 3}}}}"))
            .isInstanceOf(MalformedContractException.class);
    }

    @Test
    @DisplayName("Should reject duplicate keys")
    void shouldRejectDuplicateKeys() {
        assertThatThrownBy(() -> load("{\"services\": {\"MyService\": {}, \"MyService\": {}}}"))
            .isInstanceOf(MalformedContractException.class)
            .hasMessageContaining("MyService");
    }

    @Test
    @DisplayName("Should reject a null document")
    void shouldRejectNullDocument() {
        assertThatThrownBy(() -> load("null"))
            .isInstanceOf(MalformedContractException.class)
            .hasMessage("Contract inline is empty");
    }

    @Test
    @DisplayName("Should report unreadable contract files")
    void shouldReportMissingFile() {
        Path missing = tempDir.resolve("missing.json");

        assertThatThrownBy(() -> loader.load(missing))
            .isInstanceOf(MalformedContractException.class)
            .hasMessageContaining("Failed to read contract file");
    }

    private Contract load(String json) throws MalformedContractException {
        return loader.load(new ByteArrayInputStream(json.getBytes(StandardCharsets.UTF_8)), "inline");
    }
}
