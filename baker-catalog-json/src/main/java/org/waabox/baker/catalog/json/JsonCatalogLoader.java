package org.waabox.baker.catalog.json;

import java.nio.file.Path;
import java.util.Iterator;
import java.util.Map;
import java.util.Objects;

import com.fasterxml.jackson.databind.JsonNode;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.waabox.baker.BakerException;
import org.waabox.baker.catalog.SigImageTemplates;
import org.waabox.baker.catalog.StaticOsImageCatalog;
import org.waabox.baker.datamodel.Distro;
import org.waabox.baker.datamodel.Distros;
import org.waabox.baker.datamodel.OsFamily;
import org.waabox.baker.datamodel.OsImageConfig;
import org.waabox.baker.datamodel.SigImageConfigTemplate;

/**
 * Loads image catalogs from JSON files.
 *
 * <p>The legacy catalog file maps each cloud name to its distros:
 * <pre>{@code
 * {
 *   "AzurePublicCloud": {
 *     "aks-ubuntu-containerd-22.04": {
 *       "imageOffer": "aks",
 *       "imageSku": "aks-ubuntu-containerd-2204",
 *       "imagePublisher": "microsoft-aks",
 *       "imageVersion": "2022.10.03"
 *     }
 *   }
 * }
 * }</pre>
 *
 * <p>The SIG template file maps each {@link OsFamily} constant name to its
 * distros:
 * <pre>{@code
 * {
 *   "UBUNTU": {
 *     "aks-ubuntu-containerd-22.04": {
 *       "definition": "2204containerd",
 *       "version": "202405.20.0"
 *     }
 *   }
 * }
 * }</pre>
 *
 * <p>Distro names are resolved through {@link Distros}. A SIG template
 * with an unknown distro name defines a new distro of its family. Legacy
 * entries with unknown distro names are skipped, as they carry no family.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class JsonCatalogLoader {

  /** The class logger. */
  private static final Logger log =
      LoggerFactory.getLogger(JsonCatalogLoader.class);

  /** Private constructor to prevent instantiation. */
  private JsonCatalogLoader() {
    throw new UnsupportedOperationException("Utility class");
  }

  /**
   * Loads the legacy per-cloud image catalog.
   *
   * @param file the catalog file, never null
   *
   * @return the catalog, never null
   *
   * @throws BakerException if the file cannot be read or is malformed
   */
  public static StaticOsImageCatalog loadOsImageCatalog(final Path file) {
    Objects.requireNonNull(file, "file must not be null");

    final JsonNode root = JsonFiles.readObject(file);
    final StaticOsImageCatalog.Builder builder =
        StaticOsImageCatalog.builder();

    final Iterator<Map.Entry<String, JsonNode>> clouds = root.fields();
    while (clouds.hasNext()) {
      final Map.Entry<String, JsonNode> cloud = clouds.next();
      final String cloudName = cloud.getKey();
      builder.cloud(cloudName);

      final JsonNode distros = JsonFiles.requireObject(root, cloudName, file);
      distros.fields().forEachRemaining(entry -> {
        final Distro distro = Distros.byName(entry.getKey()).orElse(null);
        if (distro == null) {
          log.warn("Skipping unknown distro '{}' of cloud '{}' in {}",
              entry.getKey(), cloudName, file);
          return;
        }
        final JsonNode image = entry.getValue();
        builder.image(cloudName, distro, new OsImageConfig(
            JsonFiles.requireText(image, "imageOffer", file),
            JsonFiles.requireText(image, "imageSku", file),
            JsonFiles.requireText(image, "imagePublisher", file),
            JsonFiles.requireText(image, "imageVersion", file)));
      });
    }

    final StaticOsImageCatalog catalog = builder.build();
    log.info("Loaded legacy image catalog with clouds {} from {}",
        catalog.clouds(), file);
    return catalog;
  }

  /**
   * Loads the SIG image definitions.
   *
   * @param file the template file, never null
   *
   * @return the templates, never null
   *
   * @throws BakerException if the file cannot be read, is malformed, or
   *                        names an unknown family
   */
  public static SigImageTemplates loadSigImageTemplates(final Path file) {
    Objects.requireNonNull(file, "file must not be null");

    final JsonNode root = JsonFiles.readObject(file);
    final SigImageTemplates.Builder builder = SigImageTemplates.builder();

    final Iterator<String> familyNames = root.fieldNames();
    int count = 0;
    while (familyNames.hasNext()) {
      final String familyName = familyNames.next();
      final OsFamily family = family(familyName, file);

      final JsonNode distros = JsonFiles.requireObject(root, familyName,
          file);
      final Iterator<Map.Entry<String, JsonNode>> entries = distros.fields();
      while (entries.hasNext()) {
        final Map.Entry<String, JsonNode> entry = entries.next();
        final Distro distro = Distros.byName(entry.getKey())
            .orElseGet(() -> Distro.of(entry.getKey(), family));
        final JsonNode template = entry.getValue();
        builder.template(family, distro, new SigImageConfigTemplate(
            JsonFiles.requireText(template, "definition", file),
            JsonFiles.requireText(template, "version", file)));
        count++;
      }
    }

    log.info("Loaded {} SIG image definitions from {}", count, file);
    return builder.build();
  }

  /**
   * Resolves a family by its constant name.
   *
   * @param name the constant name, never null
   * @param file the file being parsed, for error messages
   *
   * @return the family, never null
   *
   * @throws BakerException if no family has that name
   */
  private static OsFamily family(final String name, final Path file) {
    try {
      return OsFamily.valueOf(name);
    } catch (final IllegalArgumentException e) {
      throw new BakerException("Unknown OS family '" + name + "' in file: "
          + file, e);
    }
  }
}
