package me.morok.sitebot.form;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

public class FormValidator {

    public static final String RATE_LIMIT = "Слишком много запросов. Пожалуйста, попробуйте позже.";
    public static final String PRIVACY_REQUIRED = "Необходимо согласиться с условиями обработки данных";
    public static final String INVALID_NAME = "Имя обязательно для заполнения";
    public static final String INVALID_PHONE = "Телефон обязателен для заполнения";
    public static final String PHONE_LENGTH = "Телефон должен содержать 10 цифр";
    public static final String NAME_TOO_SHORT = "Имя слишком короткое";
    public static final String FAKE_NAME = "Пожалуйста, введите реальное имя";
    public static final String SUBMIT_ERROR = "Не удалось отправить заявку";

    public static final String ORDER_REQUIRED = "Не заполнены обязательные поля";
    public static final String ORDER_PHONE = "Неверный формат телефона";
    public static final String ORDER_SUBMIT_ERROR = "Ошибка при отправке заказа";

    static final int PHONE_DIGITS = 10;

    static final Set<String> PLACEHOLDER_NAMES = Set.of("тест", "пример");

    /**
     * Оставляет только цифры и берёт последние 10, так что "+7 (912) 345-67-89" и "89123456789"
     * дают одно и то же.
     */
    public static String normalizePhone(String raw) {
        if (raw == null) return "";

        StringBuilder digits = new StringBuilder();
        for (int i = 0; i < raw.length(); i++) {
            char c = raw.charAt(i);
            if (c >= '0' && c <= '9') digits.append(c);
        }

        if (digits.length() <= PHONE_DIGITS) return digits.toString();
        return digits.substring(digits.length() - PHONE_DIGITS);
    }

    /**
     * Проверки телефона важнее проверок имени: короткое или тестовое имя сообщается
     * только при корректном телефоне.
     */
    public List<String> validateFeedback(FeedbackForm f) {
        List<String> errors = new ArrayList<>();

        if (f.firstname == null || f.firstname.isEmpty()) errors.add(INVALID_NAME);

        if (f.phone == null || f.phone.isEmpty()) {
            errors.add(INVALID_PHONE);
        } else if (f.phone.length() != PHONE_DIGITS) {
            errors.add(PHONE_LENGTH);
        } else if (f.firstname != null && f.firstname.length() < 2) {
            errors.add(NAME_TOO_SHORT);
        } else if (f.firstname != null && PLACEHOLDER_NAMES.contains(f.firstname.toLowerCase(Locale.ROOT))) {
            errors.add(FAKE_NAME);
        }

        return errors;
    }

    /**
     * @return текст ошибки или null, если заказ можно отправлять
     */
    public String validateOrder(OrderForm o) {
        if (isBlank(o.name) || isBlank(o.phone) || o.itemsMissing) return ORDER_REQUIRED;

        if (o.phone.length() != PHONE_DIGITS) return ORDER_PHONE;
        for (int i = 0; i < o.phone.length(); i++) {
            char c = o.phone.charAt(i);
            if (c < '0' || c > '9') return ORDER_PHONE;
        }

        // без суммы или полей позиции сообщение уйдёт с "null"
        if (isBlank(o.total) || o.itemsMalformed) return ORDER_REQUIRED;
        for (OrderForm.Item it : o.items) {
            if (isBlank(it.name) || isBlank(it.quantity) || isBlank(it.unit)
                    || isBlank(it.pricePerUnit) || isBlank(it.price)) return ORDER_REQUIRED;
        }

        return null;
    }

    static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
