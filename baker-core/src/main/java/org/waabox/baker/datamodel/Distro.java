package org.waabox.baker.datamodel;

import java.util.Objects;
import java.util.Optional;

/**
 * Identifies an OS image variant a node can request.
 *
 * <p>A distro belongs to exactly one {@link OsFamily} and may additionally
 * be a customized image, in which case it bypasses every catalog. Distros
 * are compared by all their components; the well known ones live in
 * {@link Distros}.
 *
 * @param name        the distro identifier, never null or blank
 * @param family      the family the distro belongs to, never null
 * @param customImage the custom image kind, null for catalog distros
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record Distro(String name, OsFamily family,
    CustomImageKind customImage) {

  /**
   * Creates a new distro.
   *
   * @throws NullPointerException     if name or family is null
   * @throws IllegalArgumentException if name is blank
   */
  public Distro {
    Objects.requireNonNull(name, "name must not be null");
    Objects.requireNonNull(family, "family must not be null");
    if (name.isBlank()) {
      throw new IllegalArgumentException("name must not be blank");
    }
  }

  /**
   * Creates a catalog resolved distro.
   *
   * @param name   the distro identifier, never null
   * @param family the owning family, never null
   *
   * @return the distro, never null
   */
  public static Distro of(final String name, final OsFamily family) {
    return new Distro(name, family, null);
  }

  /**
   * Creates a customized image distro.
   *
   * @param name   the distro identifier, never null
   * @param family the owning family, never null
   * @param kind   the custom image kind, never null
   *
   * @return the distro, never null
   */
  public static Distro customized(final String name, final OsFamily family,
      final CustomImageKind kind) {
    Objects.requireNonNull(kind, "kind must not be null");
    return new Distro(name, family, kind);
  }

  /**
   * Returns whether this distro boots a customer supplied image.
   *
   * @return true if a custom image kind is set
   */
  public boolean isCustomized() {
    return customImage != null;
  }

  /**
   * Returns the custom image kind.
   *
   * @return the kind, or empty for catalog distros
   */
  public Optional<CustomImageKind> customImageKind() {
    return Optional.ofNullable(customImage);
  }

  /**
   * Returns whether this distro is a Windows distro.
   *
   * @return true if the family is {@link OsFamily#WINDOWS}
   */
  public boolean isWindows() {
    return family.isWindows();
  }

  @Override
  public String toString() {
    return name;
  }
}
