package me.morok.sitebot.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class YamlConfigLoaderTest {

    @TempDir
    Path dir;

    private static final String FILLED = ""
            + "server:\n"
            + "  host: \"127.0.0.1\"\n"
            + "  port: 8080\n"
            + "  admin-key: \"adm1n\"\n"
            + "rate-limit:\n"
            + "  requests: 5\n"
            + "bot:\n"
            + "  token: \"123:abc\"\n"
            + "  admin-chat-id: 424242\n"
            + "  password: \"hunter2\"\n"
            + "storage:\n"
            + "  recipients-file: \"custom/recipients.json\"\n";

    @Test
    @DisplayName("First run writes the template and reports installation")
    void ensureDefaultConfig_firstRun_writesTemplate() {
        Path file = dir.resolve("site.yml");
        YamlConfigLoader loader = new YamlConfigLoader(file);

        loader.ensureDefaultConfig();

        assertThat(loader.wasInstalledNow()).isTrue();
        assertThat(file).exists();

        Configs configs = loader.load();
        assertThat(configs.server.port).isEqualTo(5000);
        assertThat(configs.telegram.apiUrl).isEqualTo("https://api.telegram.org");
        assertThatThrownBy(() -> loader.validate(configs)).isInstanceOf(ConfigException.class);
    }

    @Test
    @DisplayName("Existing file is left untouched")
    void ensureDefaultConfig_existing_keeps() throws Exception {
        Path file = dir.resolve("site.yml");
        Files.writeString(file, FILLED);
        YamlConfigLoader loader = new YamlConfigLoader(file);

        loader.ensureDefaultConfig();

        assertThat(loader.wasInstalledNow()).isFalse();
        assertThat(Files.readString(file)).isEqualTo(FILLED);
    }

    @Test
    @DisplayName("Values are read with defaults for missing keys")
    void load_readsValuesAndDefaults() throws Exception {
        Path file = dir.resolve("site.yml");
        Files.writeString(file, FILLED);
        YamlConfigLoader loader = new YamlConfigLoader(file);

        Configs configs = loader.load();
        loader.validate(configs);

        assertThat(configs.server.host).isEqualTo("127.0.0.1");
        assertThat(configs.server.port).isEqualTo(8080);
        assertThat(configs.server.adminKey).isEqualTo("adm1n");
        assertThat(configs.server.rateLimit.requests).isEqualTo(5);
        assertThat(configs.server.rateLimit.windowSec).isEqualTo(60);

        assertThat(configs.telegram.token).isEqualTo("123:abc");
        assertThat(configs.telegram.adminChatId).isEqualTo(424242L);
        assertThat(configs.telegram.password).isEqualTo("hunter2");
        assertThat(configs.telegram.deliveryTimeoutSec).isEqualTo(5);
        assertThat(configs.telegram.pollTimeoutSec).isEqualTo(1);
        assertThat(configs.telegram.storage.recipientsFile).isEqualTo("custom/recipients.json");
        assertThat(configs.telegram.messages.start).isEqualTo("🔑 Введите пароль для доступа:");
    }

    @Test
    @DisplayName("Missing admin chat id fails validation")
    void validate_missingAdmin_throws() throws Exception {
        Path file = dir.resolve("site.yml");
        Files.writeString(file, FILLED.replace("  admin-chat-id: 424242\n", ""));
        YamlConfigLoader loader = new YamlConfigLoader(file);

        Configs configs = loader.load();

        assertThatThrownBy(() -> loader.validate(configs))
                .isInstanceOf(ConfigException.class)
                .hasMessageContaining("admin-chat-id");
    }

    @Test
    @DisplayName("Missing file is a configuration error")
    void load_missingFile_throws() {
        YamlConfigLoader loader = new YamlConfigLoader(dir.resolve("nope.yml"));

        assertThatThrownBy(loader::load).isInstanceOf(ConfigException.class);
    }

    @Test
    @DisplayName("Saved password is read back and other settings are kept")
    void savePassword_roundTrip() throws Exception {
        Path file = dir.resolve("site.yml");
        Files.writeString(file, FILLED);
        YamlConfigLoader loader = new YamlConfigLoader(file);

        loader.savePassword("12345");

        Configs configs = loader.load();
        assertThat(configs.telegram.password).isEqualTo("12345");
        assertThat(configs.telegram.token).isEqualTo("123:abc");
        assertThat(configs.telegram.adminChatId).isEqualTo(424242L);
        assertThat(configs.server.adminKey).isEqualTo("adm1n");
    }
}
