package me.morok.sitebot.notify;

import com.fasterxml.jackson.databind.JsonNode;
import me.morok.sitebot.auth.PasswordGate;
import me.morok.sitebot.config.ConfigException;
import me.morok.sitebot.config.PasswordPersister;
import me.morok.sitebot.config.TelegramConfig;
import me.morok.sitebot.recipients.RecipientStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Telegram-часть сайта: рассылает заявки авторизованным чатам и в отдельном потоке
 * слушает {@code /start} и пароль.
 */
public class TelegramNotifier implements Notifier {

    static final Logger log = LoggerFactory.getLogger(TelegramNotifier.class);

    static long STOP_WAIT_MS = 5000;
    static long RETRY_PAUSE_MS = 1000;

    TelegramConfig config;
    RecipientStore recipients;
    TelegramClient client;
    PasswordPersister persister;

    PasswordGate gate;

    ExecutorService exec;

    volatile boolean running;
    AtomicLong offset = new AtomicLong(0);

    public TelegramNotifier(TelegramConfig config, RecipientStore recipients, TelegramClient client, PasswordPersister persister) {
        if (config == null) throw new ConfigException("Настройки бота отсутствуют");
        if (config.token == null || config.token.isBlank()) throw new ConfigException("Неверный токен бота");
        if (client == null) throw new IllegalArgumentException("client");
        if (persister == null) throw new IllegalArgumentException("persister");

        this.config = config;
        this.recipients = recipients;
        this.client = client;
        this.persister = persister;

        gate = new PasswordGate(config.adminChatId, config.password, recipients);
    }

    @Override
    public synchronized void start() {
        if (running) return;
        running = true;

        exec = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "TelegramListener");
            t.setDaemon(true);
            return t;
        });

        exec.execute(this::listen);
        log.info("Бот запущен в отдельном потоке");
    }

    @Override
    public synchronized void stop() {
        running = false;
        if (exec == null) return;

        exec.shutdown();
        try {
            if (exec.awaitTermination(STOP_WAIT_MS, TimeUnit.MILLISECONDS)) {
                log.info("Поток бота завершен");
            } else {
                log.warn("Поток бота не остановился за {} мс, продолжаем без него", STOP_WAIT_MS);
                exec.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            exec.shutdownNow();
        }
        exec = null;
    }

    public boolean isRunning() {
        return running;
    }

    @Override
    public boolean sendMessage(String text) {
        List<Long> targets = recipients.all();
        if (targets.isEmpty()) {
            log.warn("Попытка отправки без авторизованных пользователей");
            return false;
        }

        boolean success = false;
        for (Long chatId : targets) {
            try {
                TelegramClient.Response res = client.sendMessage(chatId, text);
                if (res.ok()) {
                    success = true;
                    log.info("Сообщение отправлено в чат {}", chatId);
                } else {
                    log.error("Ошибка отправки в чат {}: HTTP {} {}", chatId, res.status, res.body);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.error("Отправка прервана на чате {}", chatId);
                break;
            } catch (Exception e) {
                log.error("Ошибка при отправке в чат {}: {}", chatId, e.getMessage());
            }
        }

        return success;
    }

    @Override
    public void updatePassword(String newPassword) {
        gate.rotate(newPassword);

        try {
            persister.persist(newPassword);
        } catch (RuntimeException e) {
            log.error("Пароль изменён, но не сохранён в конфиг: {}", e.getMessage());
            throw e;
        }

        log.info("Пароль успешно обновлен, все пользователи деавторизованы");
    }

    void listen() {
        try {
            JsonNode me = client.getMe();
            if (me == null || !me.path("ok").asBoolean(false)) {
                log.error("Критическая ошибка бота: Telegram отклонил токен, слушатель остановлен");
                return;
            }

            log.info("Бот @{} готов к работе", me.path("result").path("username").asText("?"));

            while (running && !Thread.currentThread().isInterrupted()) {
                pollOnce();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (Exception e) {
            log.error("Критическая ошибка бота: {}", e.getMessage(), e);
        } finally {
            running = false;
            log.info("Слушатель бота остановлен");
        }
    }

    void pollOnce() throws InterruptedException {
        JsonNode root;
        try {
            root = client.getUpdates(offset.get(), config.pollTimeoutSec);
        } catch (IOException e) {
            log.warn("Ошибка получения обновлений: {}", e.getMessage());
            Thread.sleep(RETRY_PAUSE_MS);
            return;
        }

        if (root == null || !root.path("ok").asBoolean(false)) {
            Thread.sleep(RETRY_PAUSE_MS);
            return;
        }

        handleUpdates(root.path("result"));
    }

    void handleUpdates(JsonNode result) {
        if (result == null || !result.isArray()) return;

        for (JsonNode upd : result) {
            long updId = upd.path("update_id").asLong(0);
            if (updId > 0) offset.accumulateAndGet(updId + 1, Math::max);

            JsonNode msg = upd.get("message");
            if (msg != null && msg.isObject()) handleMessage(msg);
        }
    }

    void handleMessage(JsonNode msg) {
        long chatId = msg.path("chat").path("id").asLong(0);
        if (chatId == 0) return;

        // фото, стикеры и прочее без текста пропускаем
        JsonNode textNode = msg.get("text");
        if (textNode == null || !textNode.isTextual()) return;
        String text = textNode.asText();

        if (PasswordGate.isCommand(text)) {
            if (isStartCommand(text)) {
                reply(chatId, config.messages.start);
                log.info("Получена команда /start от {}", chatId);
            }
            return;
        }

        switch (gate.check(chatId, text)) {
            case GRANTED:
                reply(chatId, config.messages.accessGranted);
                break;
            case DENIED:
                reply(chatId, config.messages.accessDenied);
                break;
            case INVALID_PASSWORD:
                reply(chatId, config.messages.invalidPassword);
                break;
        }
    }

    void reply(long chatId, String text) {
        try {
            TelegramClient.Response res = client.sendMessage(chatId, text);
            if (!res.ok()) log.warn("Не удалось ответить в чат {}: HTTP {}", chatId, res.status);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (Exception e) {
            log.warn("Не удалось ответить в чат {}: {}", chatId, e.getMessage());
        }
    }

    static boolean isStartCommand(String text) {
        String cmd = text.trim().split("\\s+", 2)[0].toLowerCase();
        return cmd.equals("/start") || cmd.startsWith("/start@");
    }
}
