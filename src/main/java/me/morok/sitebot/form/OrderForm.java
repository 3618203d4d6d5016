package me.morok.sitebot.form;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Заказ из каталога, приходит JSON-ом.
 */
public class OrderForm {

    public String name;
    public String phone;
    public String comment;

    public List<Item> items = new ArrayList<>();
    public String total;

    // items отсутствует совсем, а не просто пустой
    public boolean itemsMissing;
    // в items попалось что-то кроме объекта
    public boolean itemsMalformed;

    public static OrderForm fromJson(JsonNode root) {
        OrderForm f = new OrderForm();
        if (root == null || !root.isObject()) {
            f.itemsMissing = true;
            return f;
        }

        f.name = text(root.get("name"));
        f.phone = text(root.get("phone"));
        f.comment = text(root.get("comment"));

        JsonNode order = root.path("order");
        JsonNode items = order.path("items");
        if (!items.isArray()) {
            f.itemsMissing = true;
        } else {
            for (JsonNode n : items) {
                if (!n.isObject()) {
                    f.itemsMalformed = true;
                    continue;
                }

                Item it = new Item();
                it.name = text(n.get("name"));
                it.quantity = text(n.get("quantity"));
                it.unit = text(n.get("unit"));
                it.pricePerUnit = text(n.get("pricePerUnit"));
                it.price = text(n.get("price"));
                f.items.add(it);
            }
        }

        f.total = text(order.get("total"));
        return f;
    }

    static String text(JsonNode n) {
        if (n == null || n.isNull() || n.isMissingNode()) return null;
        return n.asText();
    }

    public static class Item {
        public String name;
        public String quantity;
        public String unit;
        public String pricePerUnit;
        public String price;
    }
}
