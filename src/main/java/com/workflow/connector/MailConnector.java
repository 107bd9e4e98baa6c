package com.workflow.connector;

import com.workflow.action.ActionParameters;
import com.workflow.exception.ActionParameterException;
import com.workflow.exception.TransientActionException;
import com.workflow.exception.WorkflowException;
import com.workflow.model.GeneratedReport;
import jakarta.mail.MessagingException;
import jakarta.mail.internet.MimeMessage;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.FileSystemResource;
import org.springframework.mail.MailAuthenticationException;
import org.springframework.mail.MailException;
import org.springframework.mail.MailParseException;
import org.springframework.mail.MailPreparationException;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.mail.javamail.MimeMessageHelper;
import org.springframework.stereotype.Component;

import static com.workflow.service.impl.PlanTemplates.SEND_EMAIL;

/**
 * Sends e-mail through Spring's {@link JavaMailSender}, optionally attaching a generated report.
 * Transport failures are reported as transient so a retry decorator can try again;
 * authentication and message errors are permanent.
 */
@Component
@Slf4j
public class MailConnector {

    private static final Pattern ADDRESS = Pattern.compile("^[^@\\s]+@[^@\\s]+$");

    private final JavaMailSender mailSender;
    private final String from;

    public MailConnector(JavaMailSender mailSender, @Value("${workflow.mail.from:workflow-agent@localhost}") String from) {
        this.mailSender = mailSender;
        this.from = from;
    }

    /**
     * Handler for {@code send_email}.
     * <p>
     * Requires {@code to} (one address or a comma-separated list). Accepts {@code subject},
     * {@code body} and {@code attachment} (a {@link GeneratedReport}, {@link Path} or file path).
     *
     * @return A receipt with the recipients, subject and attached file name.
     */
    public Map<String, Object> send(Map<String, Object> parameters) {
        ActionParameters params = ActionParameters.of(SEND_EMAIL, parameters);
        List<String> recipients = params.optionalStringList("to");
        if (recipients.isEmpty()) {
            throw new ActionParameterException(SEND_EMAIL, "to", "is required");
        }
        for (String recipient : recipients) {
            if (!ADDRESS.matcher(recipient).matches()) {
                throw new ActionParameterException(SEND_EMAIL, "to", "'" + recipient + "' is not a valid e-mail address");
            }
        }
        String subject = params.optionalString("subject", "Workflow report");
        String body = params.optionalString("body", "");
        Path attachment = attachmentPath(params.raw("attachment"));

        try {
            MimeMessage message = mailSender.createMimeMessage();
            MimeMessageHelper helper = new MimeMessageHelper(message, attachment != null, "UTF-8");
            helper.setFrom(from);
            helper.setTo(recipients.toArray(String[]::new));
            helper.setSubject(subject);
            helper.setText(body);
            if (attachment != null) {
                helper.addAttachment(attachment.getFileName().toString(), new FileSystemResource(attachment));
            }
            mailSender.send(message);
        } catch (MessagingException e) {
            throw new WorkflowException("Could not compose e-mail to " + recipients + ": " + e.getMessage(), e);
        } catch (MailAuthenticationException | MailParseException | MailPreparationException e) {
            throw new WorkflowException("E-mail to " + recipients + " was rejected: " + e.getMessage(), e);
        } catch (MailException e) {
            throw new TransientActionException("E-mail to " + recipients + " could not be delivered: " + e.getMessage(), e);
        }

        log.info("Sent e-mail '{}' to {}{}", subject, recipients, attachment != null ? " with attachment " + attachment.getFileName() : "");
        Map<String, Object> receipt = new LinkedHashMap<>();
        receipt.put("to", recipients);
        receipt.put("subject", subject);
        receipt.put("attachment", attachment != null ? attachment.getFileName().toString() : null);
        return receipt;
    }

    private static Path attachmentPath(Object value) {
        if (value == null) {
            return null;
        }
        Path path;
        if (value instanceof GeneratedReport report) {
            path = report.path();
        } else if (value instanceof Path p) {
            path = p;
        } else if (value instanceof String s && !s.isBlank()) {
            path = Path.of(s.trim());
        } else {
            throw new ActionParameterException(SEND_EMAIL, "attachment", "expected a report or file path but got " + value.getClass().getSimpleName());
        }
        if (!Files.isRegularFile(path)) {
            throw new ActionParameterException(SEND_EMAIL, "attachment", "file " + path + " does not exist");
        }
        return path;
    }
}
