package me.morok.sitebot.recipients;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentSkipListSet;

/**
 * Получатели хранятся JSON-массивом id чатов. Файл переписывается целиком при каждом изменении.
 */
public class TelegramRecipientsStore implements RecipientStore {

    static final Logger log = LoggerFactory.getLogger(TelegramRecipientsStore.class);

    ObjectMapper json = new ObjectMapper();

    Path file;

    ConcurrentSkipListSet<Long> ids = new ConcurrentSkipListSet<>();

    public TelegramRecipientsStore(Path file) {
        this.file = file;
    }

    @Override
    public void add(long id) {
        if (id == 0) return;
        if (!ids.add(id)) return;
        save();
    }

    @Override
    public boolean contains(long id) {
        return ids.contains(id);
    }

    @Override
    public List<Long> all() {
        return new ArrayList<>(ids);
    }

    @Override
    public boolean isEmpty() {
        return ids.isEmpty();
    }

    @Override
    public synchronized void clear() {
        ids.clear();
        try {
            Files.deleteIfExists(file);
        } catch (Exception e) {
            log.error("Не удалось удалить файл получателей {}: {}", file, e.getMessage());
        }
    }

    @Override
    public synchronized void load() {
        ids.clear();
        try {
            if (!Files.exists(file)) return;

            JsonNode root = json.readTree(Files.readString(file));
            if (root == null || !root.isArray()) {
                log.error("Файл получателей {} не является JSON-массивом, список пуст", file);
                return;
            }

            for (JsonNode n : root) {
                long v = n.asLong(0);
                if (v != 0) ids.add(v);
            }

            log.info("Загружено получателей: {}", ids.size());
        } catch (Exception e) {
            ids.clear();
            log.error("Ошибка загрузки получателей из {}: {}", file, e.getMessage());
        }
    }

    @Override
    public synchronized void save() {
        try {
            ArrayNode arr = json.createArrayNode();
            for (Long id : ids) arr.add(id);

            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) Files.createDirectories(parent);
            Files.writeString(file, json.writeValueAsString(arr));
        } catch (Exception e) {
            log.error("Ошибка сохранения получателей в {}: {}", file, e.getMessage());
        }
    }
}
