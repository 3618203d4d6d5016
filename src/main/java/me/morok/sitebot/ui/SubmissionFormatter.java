package me.morok.sitebot.ui;

import me.morok.sitebot.form.FeedbackForm;
import me.morok.sitebot.form.OrderForm;
import me.morok.sitebot.util.TimeUtil;

/**
 * Текстовые сообщения в Telegram по заявкам с сайта.
 */
public class SubmissionFormatter {

    TimeUtil time;

    public SubmissionFormatter(TimeUtil time) {
        this.time = time;
    }

    public String formatFeedback(FeedbackForm f) {
        StringBuilder sb = new StringBuilder();

        sb.append("📌 Новая заявка с сайта:\n");
        sb.append("🕒 ").append(time.now()).append("\n");
        sb.append("👤 Имя: ").append(f.firstname).append("\n");

        if (notBlank(f.lastname)) sb.append("👤 Фамилия: ").append(f.lastname).append("\n");
        if (notBlank(f.patronymic)) sb.append("👤 Отчество: ").append(f.patronymic).append("\n");

        sb.append("📞 Телефон: ").append(formatPhone(f.phone)).append("\n");

        String msg = f.message == null ? "" : f.message.trim();
        sb.append("📝 Сообщение: ").append(msg.isEmpty() ? "не указано" : msg);

        return sb.toString();
    }

    public String formatOrder(OrderForm o) {
        StringBuilder sb = new StringBuilder();

        sb.append("📦 НОВЫЙ ЗАКАЗ\n");
        sb.append("👤 Имя: ").append(o.name).append("\n");
        sb.append("📞 Телефон: ").append(formatPhone(o.phone)).append("\n");
        sb.append("💬 Комментарий: ").append(notBlank(o.comment) ? o.comment : "не указан").append("\n");
        sb.append("\n");

        sb.append("🛒 Состав заказа:\n");
        for (OrderForm.Item it : o.items) {
            sb.append("- ").append(it.name).append(": ")
                    .append(it.quantity).append(" ").append(it.unit)
                    .append(" × ").append(it.pricePerUnit).append(" ₽")
                    .append(" = ").append(it.price).append(" ₽\n");
        }
        sb.append("\n");

        sb.append("💰 Итого: ").append(o.total).append(" ₽\n");
        sb.append("🕒 ").append(time.now());

        return sb.toString();
    }

    /**
     * 10 цифр -> "+7 (912) 345-67-89". Другую длину возвращаем как есть.
     */
    public String formatPhone(String phone) {
        if (phone == null || phone.length() != 10) return phone;
        return "+7 (" + phone.substring(0, 3) + ") " + phone.substring(3, 6)
                + "-" + phone.substring(6, 8) + "-" + phone.substring(8);
    }

    static boolean notBlank(String s) {
        return s != null && !s.isBlank();
    }
}
