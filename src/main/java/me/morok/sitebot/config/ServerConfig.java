package me.morok.sitebot.config;

public class ServerConfig {

    public String host;
    public int port;

    // пустой ключ = админский эндпоинт закрыт
    public String adminKey;

    public RateLimit rateLimit = new RateLimit();

    public static class RateLimit {
        public int requests;
        public int windowSec;
    }
}
