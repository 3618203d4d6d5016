package me.morok.sitebot.auth;

import me.morok.sitebot.config.ConfigException;
import me.morok.sitebot.recipients.RecipientStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.regex.Pattern;

/**
 * Проверка пароля для единственного чата администратора. Каждое сообщение проверяется само по себе,
 * сессий нет.
 */
public class PasswordGate {

    static final Logger log = LoggerFactory.getLogger(PasswordGate.class);

    // команда в понимании Telegram: латиница, цифры, _ и необязательный @имя_бота
    static final Pattern COMMAND = Pattern.compile("^/[A-Za-z0-9_]+(@\\w+)?(\\s|$)");

    public enum Verdict {
        GRANTED,
        DENIED,
        INVALID_PASSWORD
    }

    final long adminChatId;
    final RecipientStore recipients;

    String password;

    public PasswordGate(long adminChatId, String password, RecipientStore recipients) {
        if (adminChatId == 0) throw new ConfigException("ID чата администратора не задан");
        if (password == null || password.isBlank()) throw new ConfigException("Пароль бота пустой");
        if (recipients == null) throw new IllegalArgumentException("recipients");

        this.adminChatId = adminChatId;
        this.password = password;
        this.recipients = recipients;
    }

    public long adminChatId() {
        return adminChatId;
    }

    public static boolean isCommand(String text) {
        return text != null && COMMAND.matcher(text).find();
    }

    public synchronized Verdict check(long chatId, String text) {
        // чужой чат не проходит даже с верным паролем
        if (chatId != adminChatId) return Verdict.DENIED;

        if (text != null && text.equals(password)) {
            recipients.add(chatId);
            log.info("Пользователь {} успешно авторизован", chatId);
            return Verdict.GRANTED;
        }

        log.warn("Неудачная попытка входа с ID {}", chatId);
        return Verdict.INVALID_PASSWORD;
    }

    /**
     * Меняет пароль и сбрасывает всех получателей.
     */
    public synchronized void rotate(String newPassword) {
        if (newPassword == null || newPassword.isBlank()) throw new IllegalArgumentException("Новый пароль пустой");
        // такой текст бот примет за команду и до проверки пароля он не дойдёт
        if (isCommand(newPassword)) throw new IllegalArgumentException("Пароль не может быть командой бота");

        password = newPassword;
        recipients.clear();
    }
}
