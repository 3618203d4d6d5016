package me.morok.sitebot.config;

public class Configs {

    public ServerConfig server;
    public TelegramConfig telegram;

    public Configs() {
        server = new ServerConfig();
        telegram = new TelegramConfig();
    }
}
