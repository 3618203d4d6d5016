package me.morok.sitebot.recipients;

import java.util.List;

/**
 * Множество id чатов, которым можно слать уведомления.
 */
public interface RecipientStore {

    /**
     * Добавляет id и сразу сохраняет всё множество. Повторное добавление ничего не меняет.
     */
    void add(long id);

    boolean contains(long id);

    /**
     * Снимок текущего множества.
     */
    List<Long> all();

    boolean isEmpty();

    /**
     * Удаляет все id и сам файл.
     */
    void clear();

    void load();

    void save();
}
