package me.morok.sitebot;

import me.morok.sitebot.config.ConfigException;
import me.morok.sitebot.config.Configs;
import me.morok.sitebot.config.YamlConfigLoader;
import me.morok.sitebot.notify.TelegramClient;
import me.morok.sitebot.notify.TelegramNotifier;
import me.morok.sitebot.recipients.TelegramRecipientsStore;
import me.morok.sitebot.ui.SubmissionFormatter;
import me.morok.sitebot.util.RateLimitGuard;
import me.morok.sitebot.util.TimeUtil;
import me.morok.sitebot.web.WebServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.CountDownLatch;

public class Loader {

    static final Logger log = LoggerFactory.getLogger(Loader.class);

    static String BRAND = "SiteBot";

    public static void main(String[] args) {
        String configPath = args.length > 0 ? args[0] : "site.yml";

        log.info("---------------- {} запускается ----------------", BRAND);

        YamlConfigLoader loader = new YamlConfigLoader(Path.of(configPath));

        Configs configs;
        try {
            loader.ensureDefaultConfig();

            if (loader.wasInstalledNow()) {
                log.info("Похоже, это первый запуск. Конфиг создан: {}", loader.file().toAbsolutePath());
                log.info("Заполни bot.token, bot.admin-chat-id, bot.password и server.admin-key, потом запусти снова.");
                return;
            }

            configs = loader.load();
            loader.validate(configs);
        } catch (ConfigException e) {
            log.error("Ошибка конфигурации: {}. Бот остановлен.", e.getMessage());
            return;
        }

        TelegramRecipientsStore recipients = new TelegramRecipientsStore(Path.of(configs.telegram.storage.recipientsFile));
        recipients.load();

        TelegramClient client = new TelegramClient(
                configs.telegram.apiUrl,
                configs.telegram.token,
                Duration.ofSeconds(configs.telegram.deliveryTimeoutSec)
        );

        TelegramNotifier telegram = new TelegramNotifier(configs.telegram, recipients, client, loader::savePassword);

        RateLimitGuard limiter = new RateLimitGuard(
                configs.server.rateLimit.requests,
                configs.server.rateLimit.windowSec * 1000L
        );

        WebServer web = new WebServer(configs.server, telegram, new SubmissionFormatter(new TimeUtil()), limiter);

        telegram.start();
        try {
            web.start();
        } catch (RuntimeException e) {
            log.error("Не удалось запустить веб-сервер: {}", e.getMessage(), e);
            telegram.stop();
            return;
        }

        log.info("Готово. Открой бота в Telegram и отправь /start");

        CountDownLatch latch = new CountDownLatch(1);

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Остановка...");
            web.stop();
            telegram.stop();
            latch.countDown();
            log.info("Остановлено.");
        }, "ShutdownHook"));

        try {
            latch.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
