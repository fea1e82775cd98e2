package org.waabox.baker.catalog;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

import org.waabox.baker.datamodel.Distro;
import org.waabox.baker.datamodel.OsFamily;
import org.waabox.baker.datamodel.SigImageConfigTemplate;

/**
 * The region independent image definitions of every family, the input
 * {@link GallerySigCatalogProvider} binds to galleries.
 *
 * <p>This class is immutable and thread-safe.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class SigImageTemplates {

  /** The templates, keyed by family then by distro. */
  private final Map<OsFamily, Map<Distro, SigImageConfigTemplate>> templates;

  /**
   * Creates a new template set.
   *
   * @param theTemplates the templates, never null
   */
  private SigImageTemplates(
      final Map<OsFamily, Map<Distro, SigImageConfigTemplate>> theTemplates) {
    final Map<OsFamily, Map<Distro, SigImageConfigTemplate>> copy =
        new EnumMap<>(OsFamily.class);
    for (final OsFamily family : OsFamily.values()) {
      final Map<Distro, SigImageConfigTemplate> forFamily =
          theTemplates.get(family);
      copy.put(family, forFamily == null
          ? Collections.emptyMap()
          : Collections.unmodifiableMap(new LinkedHashMap<>(forFamily)));
    }
    templates = Collections.unmodifiableMap(copy);
  }

  /**
   * Starts a new builder.
   *
   * @return the builder, never null
   */
  public static Builder builder() {
    return new Builder();
  }

  /**
   * Returns the templates of a family.
   *
   * @param family the family, never null
   *
   * @return the templates keyed by distro, never null, unmodifiable
   */
  public Map<Distro, SigImageConfigTemplate> forFamily(
      final OsFamily family) {
    Objects.requireNonNull(family, "family must not be null");
    return templates.get(family);
  }

  /** Builder for {@link SigImageTemplates}. */
  public static final class Builder {

    /** The templates collected so far. */
    private final Map<OsFamily, Map<Distro, SigImageConfigTemplate>>
        templates = new EnumMap<>(OsFamily.class);

    /** Creates a new builder. */
    private Builder() {
    }

    /**
     * Adds a template to a family.
     *
     * @param family   the family, never null
     * @param distro   the distro, never null
     * @param template the template, never null
     *
     * @return this builder for chaining, never null
     */
    public Builder template(final OsFamily family, final Distro distro,
        final SigImageConfigTemplate template) {
      Objects.requireNonNull(family, "family must not be null");
      Objects.requireNonNull(distro, "distro must not be null");
      Objects.requireNonNull(template, "template must not be null");
      templates.computeIfAbsent(family, f -> new LinkedHashMap<>())
          .put(distro, template);
      return this;
    }

    /**
     * Builds the template set.
     *
     * @return the templates, never null
     */
    public SigImageTemplates build() {
      return new SigImageTemplates(templates);
    }
  }
}
