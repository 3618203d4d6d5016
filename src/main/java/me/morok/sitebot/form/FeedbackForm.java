package me.morok.sitebot.form;

/**
 * Форма "Обратная связь" после обрезки пробелов. В {@code phone} только цифры.
 */
public class FeedbackForm {

    public String firstname = "";
    public String lastname = "";
    public String patronymic = "";
    public String phone = "";
    public String message = "";

    public boolean privacyAccepted;
}
