package me.morok.sitebot.config;

/**
 * Фатальная ошибка конфига: нет данных бота или файл не читается.
 * Бросается при старте, без исправления конфига приложение не запустится.
 */
public class ConfigException extends RuntimeException {

    public ConfigException(String message) {
        super(message);
    }

    public ConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
