package com.volunteermedia.notification;

import org.springframework.web.util.HtmlUtils;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;

/**
 * HTML bodies and subjects for outgoing email. All user-supplied text is HTML-escaped.
 */
final class EmailTemplates {

    private static final String STYLE =
            "body { font-family: Arial, sans-serif; line-height: 1.6; color: #333; }\n"
            + ".container { max-width: 600px; margin: 0 auto; padding: 20px; }\n"
            + ".header { background-color: #0e6c55; color: white; padding: 20px; text-align: center; }\n"
            + ".content { padding: 20px; background-color: #f8fafc; }\n"
            + ".button { display: inline-block; padding: 12px 24px; background-color: #0e6c55; color: white; "
            + "text-decoration: none; border-radius: 4px; margin: 20px 0; }\n"
            + ".footer { text-align: center; padding: 20px; font-size: 12px; color: #666; }\n";

    private EmailTemplates() {
    }

    static String passwordResetSubject(String siteName) {
        return String.format("Password Reset Request - %s", siteName);
    }

    static String passwordResetBody(String siteName, String username, String link) {
        String content = "<p>Hello " + escape(username) + ",</p>\n"
                + "<p>We received a request to reset your password for your " + escape(siteName) + " account.</p>\n"
                + "<p>Click the button below to reset your password:</p>\n"
                + button(link, "Reset Password")
                + "<p>Or copy and paste this link into your browser:</p>\n"
                + "<p style=\"word-break: break-all; color: #0e6c55;\">" + escape(link) + "</p>\n"
                + "<p><strong>This link will expire in 1 hour.</strong></p>\n"
                + "<p>If you didn't request a password reset, you can safely ignore this email.</p>\n";
        return layout(siteName, "Password Reset Request", content);
    }

    static String passwordSetupSubject(String siteName) {
        return String.format("Welcome to %s - Set Your Password", siteName);
    }

    static String passwordSetupBody(String siteName, String username, String link) {
        String content = "<p>Hello " + escape(username) + ",</p>\n"
                + "<p>An account has been created for you on " + escape(siteName) + ".</p>\n"
                + "<p>Click the button below to choose your password and finish setting up your account:</p>\n"
                + button(link, "Set Your Password")
                + "<p>Or copy and paste this link into your browser:</p>\n"
                + "<p style=\"word-break: break-all; color: #0e6c55;\">" + escape(link) + "</p>\n"
                + "<p><strong>This link will expire in 24 hours.</strong></p>\n";
        return layout(siteName, "Welcome to " + siteName, content);
    }

    static String announcementSubject(String siteName, String title) {
        return String.format("Announcement: %s - %s", title, siteName);
    }

    static String announcementBody(String siteName, String title, String content) {
        String body = "<h2>" + escape(title) + "</h2>\n"
                + "<p>" + escape(content).replace("\n", "<br>") + "</p>\n";
        return layout(siteName, "Announcement", body);
    }

    static String link(String frontendUrl, String path, String token) {
        String base = frontendUrl.endsWith("/") ? frontendUrl.substring(0, frontendUrl.length() - 1) : frontendUrl;
        return base + path + "?token=" + URLEncoder.encode(token, StandardCharsets.UTF_8);
    }

    private static String button(String link, String label) {
        return "<p style=\"text-align: center;\">\n"
                + "<a href=\"" + escape(link) + "\" class=\"button\">" + label + "</a>\n"
                + "</p>\n";
    }

    private static String layout(String siteName, String heading, String content) {
        return "<!DOCTYPE html>\n<html>\n<head>\n<style>\n" + STYLE + "</style>\n</head>\n<body>\n"
                + "<div class=\"container\">\n"
                + "<div class=\"header\"><h1>" + escape(heading) + "</h1></div>\n"
                + "<div class=\"content\">\n" + content + "</div>\n"
                + "<div class=\"footer\"><p>&copy; " + escape(siteName)
                + " - This is an automated message, please do not reply.</p></div>\n"
                + "</div>\n</body>\n</html>\n";
    }

    private static String escape(String value) {
        return value == null ? "" : HtmlUtils.htmlEscape(value);
    }
}
