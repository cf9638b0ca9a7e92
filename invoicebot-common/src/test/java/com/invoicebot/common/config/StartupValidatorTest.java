package com.invoicebot.common.config;

import com.invoicebot.common.auth.RefreshTokenStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.lang.reflect.Field;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class StartupValidatorTest {

    @TempDir
    Path dataDir;

    private InvoiceBotProperties properties;
    private RefreshTokenStore tokenStore;
    private StartupValidator validator;

    @BeforeEach
    void setUp() throws Exception {
        properties = new InvoiceBotProperties();
        properties.getStorage().setRootFolder("Invoices");
        properties.getAccountant().setEmail("accounting@example.com");
        tokenStore = new RefreshTokenStore(dataDir.resolve(RefreshTokenStore.FILENAME));
        validator = new StartupValidator(properties, tokenStore);
        setField("graphClientId", "client-123");
        setField("graphRefreshToken", "refresh-abc");
    }

    private void setField(String name, String value) throws Exception {
        Field field = StartupValidator.class.getDeclaredField(name);
        field.setAccessible(true);
        field.set(validator, value);
    }

    @Test
    @DisplayName("Should accept a complete configuration")
    void validate_shouldPassWithRequiredValues() {
        assertDoesNotThrow(() -> validator.validate());
    }

    @Test
    @DisplayName("Should fail when the storage root folder is missing")
    void validate_shouldFailWithoutRootFolder() {
        properties.getStorage().setRootFolder(" ");

        IllegalStateException e = assertThrows(IllegalStateException.class, () -> validator.validate());
        assertTrue(e.getMessage().contains("invoicebot.storage.root-folder"));
    }

    @Test
    @DisplayName("Should fail when the Graph client id is missing")
    void validate_shouldFailWithoutClientId() throws Exception {
        setField("graphClientId", "");

        IllegalStateException e = assertThrows(IllegalStateException.class, () -> validator.validate());
        assertTrue(e.getMessage().contains("GRAPH_CLIENT_ID"));
    }

    @Test
    @DisplayName("Should fail at startup when no refresh token is configured or stored")
    void validate_shouldFailWithoutRefreshToken() throws Exception {
        setField("graphRefreshToken", "");

        IllegalStateException e = assertThrows(IllegalStateException.class, () -> validator.validate());
        assertTrue(e.getMessage().contains("graph.refresh-token"));
    }

    @Test
    @DisplayName("Should accept a refresh token stored by an earlier run in place of a configured one")
    void validate_shouldAcceptStoredRefreshToken() throws Exception {
        setField("graphRefreshToken", "");
        tokenStore.save("rotated-token");

        assertDoesNotThrow(() -> validator.validate());
    }

    @Test
    @DisplayName("Should fail when the accountant address is missing or malformed")
    void validate_shouldFailWithoutAccountantEmail() {
        properties.getAccountant().setEmail(null);
        IllegalStateException missing = assertThrows(IllegalStateException.class, () -> validator.validate());
        assertTrue(missing.getMessage().contains("invoicebot.accountant.email"));

        properties.getAccountant().setEmail("accounting");
        assertThrows(IllegalStateException.class, () -> validator.validate());
    }

    @Test
    @DisplayName("Should reject a chunk size that is not a multiple of 320 KiB")
    void validate_shouldRejectMisalignedChunkSize() {
        properties.getStorage().setChunkSize(1000);

        assertThrows(IllegalStateException.class, () -> validator.validate());
    }
}
