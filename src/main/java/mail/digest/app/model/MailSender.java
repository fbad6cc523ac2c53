package mail.digest.app.model;

import lombok.Value;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Display name plus address of a message author. The address is kept lower-case
 * so it can be used directly as a grouping and importance key.
 */
@Value
public class MailSender {
    private static final Pattern NAME_ADDR = Pattern.compile("^\\s*\"?([^\"<]*?)\"?\\s*<([^>]+)>\\s*$");

    String displayName;
    String address;

    public MailSender(String displayName, String address) {
        this.address = address == null ? "" : address.trim().toLowerCase(Locale.ROOT);
        this.displayName = displayName == null || displayName.isBlank() ? this.address : displayName.trim();
    }

    /**
     * Parse a From header such as {@code "Alice Smith" <alice@x.com>} or a bare address.
     */
    public static MailSender parse(String header) {
        if (header == null || header.isBlank()) {
            return new MailSender("", "");
        }
        Matcher m = NAME_ADDR.matcher(header);
        if (m.matches()) {
            return new MailSender(m.group(1), m.group(2));
        }
        return new MailSender(null, header);
    }

    @Override
    public String toString() {
        return displayName.equals(address) ? address : displayName + " <" + address + ">";
    }
}
