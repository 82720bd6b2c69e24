package br.com.may.shared.email;

public interface EmailService {
    void sendPlainTextEmail(String to, String subject, String body);
}
