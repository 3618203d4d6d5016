package me.morok.sitebot.config;

public class TelegramConfig {

    public String token;
    public long adminChatId;
    public String password;
    public String apiUrl;

    public int pollTimeoutSec;
    public int deliveryTimeoutSec;

    public Storage storage = new Storage();
    public Messages messages = new Messages();

    public static class Storage {
        public String recipientsFile;
    }

    public static class Messages {
        public String start;
        public String accessGranted;
        public String accessDenied;
        public String invalidPassword;
    }
}
