package mailbridge.model;

import java.util.Arrays;
import java.util.Objects;

/**
 * A part of a {@link Mail} that was carried as an attachment.
 *
 * @param number  sequence number of the part within the message; {@code >= 0}, need not be contiguous
 * @param name    file name, may be {@code null}
 * @param type    MIME type, e.g. {@code text/plain}
 * @param charset charset of a textual attachment, may be {@code null}
 * @param data    the attachment bytes as received
 */
public record Attachment(int number, String name, String type, String charset, byte[] data) {

  public Attachment {
    if (number < 0) {
      throw new IllegalArgumentException("number must be >= 0, got: " + number);
    }
    Objects.requireNonNull(type, "type");
    Objects.requireNonNull(data, "data");
    data = Arrays.copyOf(data, data.length);
  }

  @Override
  public byte[] data() {
    return Arrays.copyOf(data, data.length);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof Attachment other)) return false;
    return number == other.number
        && Objects.equals(name, other.name)
        && type.equals(other.type)
        && Objects.equals(charset, other.charset)
        && Arrays.equals(data, other.data);
  }

  @Override
  public int hashCode() {
    return Objects.hash(number, name, type, charset) * 31 + Arrays.hashCode(data);
  }

  @Override
  public String toString() {
    return "Attachment{number=" + number + ", name=" + name + ", type=" + type + "}";
  }
}
