package me.morok.sitebot.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.DumperOptions;
import org.yaml.snakeyaml.Yaml;

import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.LinkedHashMap;
import java.util.Map;

public class YamlConfigLoader {

    static final Logger log = LoggerFactory.getLogger(YamlConfigLoader.class);

    static final String TEMPLATE = "site.yml";

    Path file;

    volatile boolean installedNow;

    public YamlConfigLoader(Path file) {
        this.file = file;
    }

    public Path file() {
        return file;
    }

    public boolean wasInstalledNow() {
        return installedNow;
    }

    /**
     * Кладёт шаблон конфига рядом с jar, если файла ещё нет.
     */
    public void ensureDefaultConfig() {
        try {
            if (Files.exists(file)) return;

            byte[] bytes;
            try (InputStream in = YamlConfigLoader.class.getClassLoader().getResourceAsStream(TEMPLATE)) {
                if (in == null) throw new ConfigException("Не найден шаблон " + TEMPLATE + " в resources");
                bytes = in.readAllBytes();
            }

            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) Files.createDirectories(parent);
            Files.write(file, bytes);

            installedNow = true;
            log.info("Создан конфиг по умолчанию: {}", file.toAbsolutePath());
        } catch (ConfigException e) {
            throw e;
        } catch (Exception e) {
            throw new ConfigException("Не удалось создать " + file + ": " + e.getMessage(), e);
        }
    }

    public Configs load() {
        Map<String, Object> src = readYaml();

        Configs out = new Configs();
        applyServer(out.server, src);
        applyTelegram(out.telegram, src);
        return out;
    }

    /**
     * Проверка того, без чего бот не стартует.
     */
    public void validate(Configs configs) {
        TelegramConfig tg = configs.telegram;
        if (tg.token == null || tg.token.isBlank()) throw new ConfigException("bot.token пустой");
        if (tg.adminChatId == 0) throw new ConfigException("bot.admin-chat-id не задан");
        if (tg.password == null || tg.password.isBlank()) throw new ConfigException("bot.password пустой");
        if (configs.server.port <= 0 || configs.server.port > 65535) {
            throw new ConfigException("server.port некорректный: " + configs.server.port);
        }
    }

    /**
     * Переписывает bot.password в файле конфига. Остальные ключи сохраняются как были,
     * комментарии шаблона теряются.
     */
    public synchronized void savePassword(String password) {
        try {
            Map<String, Object> root = new LinkedHashMap<>(readYaml());

            Object bot = root.get("bot");
            Map<String, Object> botMap = bot instanceof Map
                    ? new LinkedHashMap<>((Map<String, Object>) bot)
                    : new LinkedHashMap<>();
            botMap.put("password", password);
            root.put("bot", botMap);

            DumperOptions opts = new DumperOptions();
            opts.setDefaultFlowStyle(DumperOptions.FlowStyle.BLOCK);
            opts.setPrettyFlow(true);
            String text = new Yaml(opts).dump(root);

            Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
            Files.writeString(tmp, text, StandardCharsets.UTF_8);
            Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (ConfigException e) {
            throw e;
        } catch (Exception e) {
            throw new ConfigException("Не удалось сохранить пароль в " + file + ": " + e.getMessage(), e);
        }
    }

    void applyServer(ServerConfig c, Map<String, Object> src) {
        c.host = str(get(src, "server.host"), "0.0.0.0");
        c.port = intVal(get(src, "server.port"), 5000);
        c.adminKey = str(get(src, "server.admin-key"));

        c.rateLimit.requests = Math.max(1, intVal(get(src, "rate-limit.requests"), 3));
        c.rateLimit.windowSec = Math.max(1, intVal(get(src, "rate-limit.window-sec"), 60));
    }

    void applyTelegram(TelegramConfig c, Map<String, Object> src) {
        c.token = str(get(src, "bot.token"));
        c.adminChatId = longVal(get(src, "bot.admin-chat-id"), 0);
        c.password = str(get(src, "bot.password"));
        c.apiUrl = str(get(src, "bot.api-url"), "https://api.telegram.org");

        c.pollTimeoutSec = Math.max(1, intVal(get(src, "polling.timeout-sec"), 1));
        c.deliveryTimeoutSec = Math.max(1, intVal(get(src, "delivery.timeout-sec"), 5));

        c.storage.recipientsFile = str(get(src, "storage.recipients-file"), "data/recipients/telegram.json");

        c.messages.start = str(get(src, "messages.start"), "🔑 Введите пароль для доступа:");
        c.messages.accessGranted = str(get(src, "messages.access-granted"), "🔐 Доступ разрешен");
        c.messages.accessDenied = str(get(src, "messages.access-denied"), "❌ Доступ запрещен");
        c.messages.invalidPassword = str(get(src, "messages.invalid-password"), "❌ Неверный пароль");
    }

    Map<String, Object> readYaml() {
        try {
            if (!Files.exists(file)) throw new ConfigException("Не найден конфиг: " + file.toAbsolutePath());

            Object obj = new Yaml().load(Files.readString(file, StandardCharsets.UTF_8));
            if (!(obj instanceof Map)) return Map.of();
            return (Map<String, Object>) obj;
        } catch (ConfigException e) {
            throw e;
        } catch (Exception e) {
            throw new ConfigException("Ошибка чтения " + file + ": " + e.getMessage(), e);
        }
    }

    Object get(Map<String, Object> root, String path) {
        if (root == null) return null;

        String[] parts = path.split("\\.");
        Object cur = root;

        for (String p : parts) {
            if (!(cur instanceof Map)) return null;
            cur = ((Map<String, Object>) cur).get(p);
            if (cur == null) return null;
        }

        return cur;
    }

    String str(Object o) {
        if (o == null) return null;
        return String.valueOf(o);
    }

    String str(Object o, String def) {
        String v = str(o);
        if (v == null || v.isBlank()) return def;
        return v;
    }

    int intVal(Object o, int def) {
        if (o == null) return def;
        if (o instanceof Number) return ((Number) o).intValue();
        try {
            return Integer.parseInt(String.valueOf(o).trim());
        } catch (NumberFormatException e) {
            return def;
        }
    }

    long longVal(Object o, long def) {
        if (o == null) return def;
        if (o instanceof Number) return ((Number) o).longValue();
        try {
            return Long.parseLong(String.valueOf(o).trim());
        } catch (NumberFormatException e) {
            return def;
        }
    }
}
