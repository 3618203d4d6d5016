package me.morok.sitebot.notify;

public interface Notifier {

    void start();

    void stop();

    /**
     * Рассылка всем авторизованным получателям.
     *
     * @return true, если сообщение дошло хотя бы до одного получателя
     */
    boolean sendMessage(String text);

    /**
     * Меняет пароль и снимает авторизацию со всех получателей.
     */
    void updatePassword(String newPassword);
}
