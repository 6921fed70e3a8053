package org.pgninja.connection;

import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.Properties;

import static org.assertj.core.api.Assertions.assertThat;

class ConnectionSettingsTest {

    @Test
    void driverProperties_mergeCredentialsIntoExtraProperties() {
        ConnectionSettings s = new ConnectionSettings("jdbc:postgresql://db/app", "app", "secret",
                Map.of("sslmode", "require"));

        Properties props = s.driverProperties();

        assertThat(props).containsEntry("sslmode", "require")
                .containsEntry("user", "app")
                .containsEntry("password", "secret");
    }

    @Test
    void driverProperties_omitCredentialsWithoutUsername() {
        assertThat(ConnectionSettings.of("jdbc:h2:mem:x").driverProperties()).isEmpty();
    }

    @Test
    void toString_hidesPassword() {
        assertThat(ConnectionSettings.of("jdbc:h2:mem:x", "sa", "secret").toString()).doesNotContain("secret");
    }
}
