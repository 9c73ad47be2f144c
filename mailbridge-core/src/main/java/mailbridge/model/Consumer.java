package mailbridge.model;

import java.util.Objects;

/**
 * A registered delivery target.
 *
 * @param id   synthetic identifier assigned by the store on creation
 * @param name display name
 */
public record Consumer(int id, String name) {
  public Consumer {
    Objects.requireNonNull(name, "name");
  }
}
