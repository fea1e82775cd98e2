package org.waabox.baker.catalog.json;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import com.fasterxml.jackson.databind.JsonNode;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.waabox.baker.BakerException;
import org.waabox.baker.vhd.ContainerImage;
import org.waabox.baker.vhd.DownloadFile;
import org.waabox.baker.vhd.ImageVersion;
import org.waabox.baker.vhd.ManifestDependency;
import org.waabox.baker.vhd.VhdInventories;
import org.waabox.baker.vhd.VhdManifest;

/**
 * Populates {@link VhdInventories} from the manifest and component files
 * baked into a node image.
 *
 * <p>{@code manifest.json} maps each dependency name to its record.
 * Keys starting with {@code _} hold templates and are skipped.
 *
 * <p>{@code components.json} holds two arrays: {@code ContainerImages},
 * keyed by the repository name of each image's download URL, and
 * {@code DownloadFiles}, keyed by file name.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class JsonVhdInventoryLoader {

  /** The class logger. */
  private static final Logger log =
      LoggerFactory.getLogger(JsonVhdInventoryLoader.class);

  /** Private constructor to prevent instantiation. */
  private JsonVhdInventoryLoader() {
    throw new UnsupportedOperationException("Utility class");
  }

  /**
   * Parses both files and populates the three inventories.
   *
   * <p>Both files are parsed before any inventory is populated, so a
   * malformed file leaves the inventories untouched.
   *
   * @param inventories   the inventories to populate, never null
   * @param manifestFile  the manifest file, never null
   * @param componentFile the components file, never null
   *
   * @throws BakerException        if a file cannot be read or is malformed
   * @throws IllegalStateException if an inventory was already populated
   */
  public static void populate(final VhdInventories inventories,
      final Path manifestFile, final Path componentFile) {
    Objects.requireNonNull(inventories, "inventories must not be null");
    Objects.requireNonNull(componentFile, "componentFile must not be null");

    final VhdManifest manifest = loadManifest(manifestFile);

    final JsonNode components = JsonFiles.readObject(componentFile);
    final Map<String, ContainerImage> images =
        containerImages(components, componentFile);
    final Map<String, DownloadFile> files =
        downloadFiles(components, componentFile);

    inventories.populateManifest(manifest);
    inventories.populateContainerImages(images);
    inventories.populateDownloadedFiles(files);

    log.info("Loaded VHD inventories: {} manifest dependencies, {} container"
        + " images, {} downloaded files", manifest.dependencies().size(),
        images.size(), files.size());
  }

  /**
   * Parses the image manifest.
   *
   * @param file the manifest file, never null
   *
   * @return the manifest, never null
   *
   * @throws BakerException if the file cannot be read or is malformed
   */
  public static VhdManifest loadManifest(final Path file) {
    Objects.requireNonNull(file, "file must not be null");

    final JsonNode root = JsonFiles.readObject(file);
    final Map<String, ManifestDependency> dependencies =
        new LinkedHashMap<>();

    root.fields().forEachRemaining(entry -> {
      if (entry.getKey().startsWith("_")) {
        return;
      }
      final JsonNode node = entry.getValue();
      if (!node.isObject()) {
        throw new BakerException("Dependency '" + entry.getKey()
            + "' is not an object in file: " + file);
      }
      dependencies.put(entry.getKey(), new ManifestDependency(
          JsonFiles.optionalText(node, "fileName"),
          JsonFiles.optionalText(node, "downloadLocation"),
          JsonFiles.optionalText(node, "downloadURL"),
          JsonFiles.optionalTexts(node, "versions"),
          textMap(node.get("pinned")),
          JsonFiles.optionalText(node, "edge"),
          textMap(node.get("installed"))));
    });

    return new VhdManifest(dependencies);
  }

  /**
   * Parses the {@code ContainerImages} array.
   *
   * @param root the components root, never null
   * @param file the components file, for error messages
   *
   * @return the images keyed by repository name, never null
   */
  private static Map<String, ContainerImage> containerImages(
      final JsonNode root, final Path file) {
    final Map<String, ContainerImage> images = new LinkedHashMap<>();
    for (final JsonNode node : array(root, "ContainerImages", file)) {
      final List<ImageVersion> multiArch = new ArrayList<>();
      final JsonNode versions = node.get("multiArchVersionsV2");
      if (versions != null && versions.isArray()) {
        versions.forEach(version -> multiArch.add(new ImageVersion(
            JsonFiles.requireText(version, "latestVersion", file),
            JsonFiles.optionalText(version, "previousLatestVersion"))));
      }
      final ContainerImage image = new ContainerImage(
          JsonFiles.requireText(node, "downloadURL", file),
          JsonFiles.optionalTexts(node, "amd64OnlyVersions"),
          multiArch);
      images.put(image.repositoryName(), image);
    }
    return images;
  }

  /**
   * Parses the {@code DownloadFiles} array.
   *
   * @param root the components root, never null
   * @param file the components file, for error messages
   *
   * @return the files keyed by file name, never null
   */
  private static Map<String, DownloadFile> downloadFiles(
      final JsonNode root, final Path file) {
    final Map<String, DownloadFile> files = new LinkedHashMap<>();
    for (final JsonNode node : array(root, "DownloadFiles", file)) {
      final DownloadFile downloadFile = new DownloadFile(
          JsonFiles.requireText(node, "fileName", file),
          JsonFiles.optionalText(node, "downloadLocation"),
          JsonFiles.optionalText(node, "downloadURL"),
          JsonFiles.optionalTexts(node, "versions"));
      files.put(downloadFile.fileName(), downloadFile);
    }
    return files;
  }

  /**
   * Returns an array field, or an empty array when missing.
   *
   * @param root  the parent node, never null
   * @param field the field name, never null
   * @param file  the file being parsed, for error messages
   *
   * @return the elements, never null
   *
   * @throws BakerException if the field is present but not an array
   */
  private static List<JsonNode> array(final JsonNode root,
      final String field, final Path file) {
    final JsonNode value = root.get(field);
    final List<JsonNode> elements = new ArrayList<>();
    if (value == null || value.isNull()) {
      return elements;
    }
    if (!value.isArray()) {
      throw new BakerException("Field '" + field + "' is not an array in"
          + " file: " + file);
    }
    value.forEach(elements::add);
    return elements;
  }

  /**
   * Converts an object of strings to a map.
   *
   * @param node the object, may be null
   *
   * @return the map, never null
   */
  private static Map<String, String> textMap(final JsonNode node) {
    final Map<String, String> map = new LinkedHashMap<>();
    if (node != null && node.isObject()) {
      node.fields().forEachRemaining(entry ->
          map.put(entry.getKey(), entry.getValue().asText()));
    }
    return map;
  }
}
