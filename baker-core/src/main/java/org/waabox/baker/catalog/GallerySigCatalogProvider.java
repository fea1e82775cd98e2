package org.waabox.baker.catalog;

import java.util.Map;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.waabox.baker.SigResolutionException;
import org.waabox.baker.datamodel.CloudSpecConfig;
import org.waabox.baker.datamodel.Distro;
import org.waabox.baker.datamodel.OsFamily;
import org.waabox.baker.datamodel.SigAzureEnvironmentSpecConfig;
import org.waabox.baker.datamodel.SigConfig;
import org.waabox.baker.datamodel.SigGalleryConfig;
import org.waabox.baker.datamodel.SigImageConfigTemplate;

/**
 * A {@link SigCatalogProvider} binding fixed image definitions to the
 * galleries named by a {@link SigConfig}.
 *
 * <p>Every family with at least one template must have its gallery key
 * configured in the selector; the gallery's name and resource group, plus
 * the selector's subscription, complete each template into a
 * {@code SigImageConfig}. The cloud name of the environment is derived
 * from the region.
 *
 * <p>This class is immutable and thread-safe.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class GallerySigCatalogProvider implements SigCatalogProvider {

  /** The class logger. */
  private static final Logger log =
      LoggerFactory.getLogger(GallerySigCatalogProvider.class);

  /** The image definitions to bind. */
  private final SigImageTemplates templates;

  /**
   * Creates a new provider.
   *
   * @param theTemplates the image definitions, never null
   */
  public GallerySigCatalogProvider(final SigImageTemplates theTemplates) {
    templates = Objects.requireNonNull(theTemplates,
        "templates must not be null");
  }

  /** {@inheritDoc} */
  @Override
  public SigAzureEnvironmentSpecConfig resolve(final SigConfig sigConfig,
      final String region) {
    Objects.requireNonNull(sigConfig, "sigConfig must not be null");
    Objects.requireNonNull(region, "region must not be null");

    if (region.isBlank()) {
      throw new SigResolutionException(region, "region is empty");
    }
    if (sigConfig.subscriptionId().isBlank()) {
      throw new SigResolutionException(region,
          "SIG subscription id is empty");
    }

    final String cloudName = CloudSpecConfig.targetCloudFor(region);
    final SigAzureEnvironmentSpecConfig.Builder builder =
        SigAzureEnvironmentSpecConfig.builder(cloudName);

    for (final OsFamily family : OsFamily.values()) {
      final Map<Distro, SigImageConfigTemplate> forFamily =
          templates.forFamily(family);
      if (forFamily.isEmpty()) {
        continue;
      }
      final SigGalleryConfig gallery = sigConfig.galleryFor(family)
          .orElseThrow(() -> new SigResolutionException(region,
              "SIG gallery configuration for " + family.galleryKey()
                  + " not found"));
      forFamily.forEach((distro, template) -> builder.image(family, distro,
          template.bind(gallery, sigConfig.subscriptionId())));
    }

    log.debug("Resolved SIG environment for region '{}' in cloud '{}'",
        region, cloudName);

    return builder.build();
  }
}
