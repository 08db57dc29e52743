package tech.ledgerbridge.broker.shared;

import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;

/**
 * Short pages shown to a user who is mid-redirect in a browser.
 */
public final class HtmlPages {

    private static final String ERROR_COLOR = "#d32f2f";
    private static final String SUCCESS_COLOR = "#2E8B57";

    private HtmlPages() {
    }

    public static Response error(Response.Status status, String title, String... lines) {
        return page(status, ERROR_COLOR, title, lines);
    }

    public static Response success(String title, String... lines) {
        return page(Response.Status.OK, SUCCESS_COLOR, title, lines);
    }

    private static Response page(Response.Status status, String color, String title, String... lines) {
        StringBuilder html = new StringBuilder()
            .append("<!DOCTYPE html>\n<html>\n<head><meta charset=\"utf-8\"><title>")
            .append(escape(title))
            .append("</title></head>\n")
            .append("<body style=\"font-family: Arial; padding: 40px; text-align: center;\">\n")
            .append("<h2 style=\"color: ").append(color).append(";\">")
            .append(escape(title))
            .append("</h2>\n");
        for (String line : lines) {
            html.append("<p>").append(escape(line)).append("</p>\n");
        }
        html.append("</body>\n</html>\n");

        return Response.status(status)
            .type(MediaType.TEXT_HTML_TYPE.withCharset("UTF-8"))
            .entity(html.toString())
            .build();
    }

    static String escape(String text) {
        if (text == null) {
            return "";
        }
        StringBuilder out = new StringBuilder(text.length());
        for (char c : text.toCharArray()) {
            switch (c) {
                case '<' -> out.append("&lt;");
                case '>' -> out.append("&gt;");
                case '&' -> out.append("&amp;");
                case '"' -> out.append("&quot;");
                case '\'' -> out.append("&#39;");
                default -> out.append(c);
            }
        }
        return out.toString();
    }
}
