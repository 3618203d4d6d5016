package me.morok.sitebot.config;

/**
 * Сохраняет новый пароль бота в постоянный конфиг.
 */
@FunctionalInterface
public interface PasswordPersister {

    /**
     * @throws ConfigException если пароль не удалось записать
     */
    void persist(String password);
}
