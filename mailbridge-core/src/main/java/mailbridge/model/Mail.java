package mailbridge.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable archived mail: the original message plus the text and attachments extracted
 * from it.
 *
 * <p>The {@code id} is the message's Message-ID without the enclosing angle brackets.
 * Attachments are kept ordered by sequence number; each sequence number appears at most
 * once. Use the {@linkplain Builder builder} to create instances.
 *
 * @see Attachment
 * @see mailbridge.archive.MailArchive
 */
public final class Mail {
    private final String id;
    private final Instant date;
    private final String text;
    private final byte[] data;
    private final List<Attachment> attachments;

    private Mail(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id");
        if (this.id.isEmpty()) {
            throw new IllegalArgumentException("id cannot be empty");
        }
        this.date = Objects.requireNonNull(builder.date, "date");
        this.text = builder.text == null ? "" : builder.text;
        Objects.requireNonNull(builder.data, "data");
        this.data = Arrays.copyOf(builder.data, builder.data.length);

        List<Attachment> sorted = new ArrayList<>(builder.attachments);
        sorted.sort(Comparator.comparingInt(Attachment::number));
        Set<Integer> seen = new HashSet<>();
        for (Attachment attachment : sorted) {
            if (!seen.add(attachment.number())) {
                throw new IllegalArgumentException(
                        "Duplicate attachment number " + attachment.number() + " in mail " + id);
            }
        }
        this.attachments = Collections.unmodifiableList(sorted);
    }

    public static Builder builder(String id) {
        return new Builder(id);
    }

    public String id() {
        return id;
    }

    /**
     * Returns the origination date of the message.
     */
    public Instant date() {
        return date;
    }

    /**
     * Returns the text extracted from the textual parts of the message; never {@code null}.
     */
    public String text() {
        return text;
    }

    /**
     * Returns a copy of the message exactly as received.
     */
    public byte[] data() {
        return Arrays.copyOf(data, data.length);
    }

    /**
     * Returns the attachments ordered by sequence number.
     */
    public List<Attachment> attachments() {
        return attachments;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Mail other)) return false;
        return id.equals(other.id)
                && date.equals(other.date)
                && text.equals(other.text)
                && Arrays.equals(data, other.data)
                && attachments.equals(other.attachments);
    }

    @Override
    public int hashCode() {
        return id.hashCode();
    }

    @Override
    public String toString() {
        return "Mail<" + id + ">";
    }

    /**
     * Builder for {@link Mail}.
     */
    public static final class Builder {
        private final String id;
        private Instant date;
        private String text;
        private byte[] data;
        private final List<Attachment> attachments = new ArrayList<>();

        private Builder(String id) {
            this.id = id;
        }

        public Builder date(Instant date) {
            this.date = date;
            return this;
        }

        public Builder text(String text) {
            this.text = text;
            return this;
        }

        public Builder data(byte[] data) {
            this.data = data;
            return this;
        }

        public Builder attachment(Attachment attachment) {
            this.attachments.add(Objects.requireNonNull(attachment, "attachment"));
            return this;
        }

        public Builder attachments(List<Attachment> attachments) {
            attachments.forEach(this::attachment);
            return this;
        }

        /**
         * @throws NullPointerException     if {@code id}, {@code date} or {@code data} is null
         * @throws IllegalArgumentException if {@code id} is empty or two attachments share a number
         */
        public Mail build() {
            return new Mail(this);
        }
    }
}
