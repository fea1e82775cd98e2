package org.waabox.baker.catalog;

import org.waabox.baker.SigResolutionException;
import org.waabox.baker.datamodel.SigAzureEnvironmentSpecConfig;
import org.waabox.baker.datamodel.SigConfig;

/**
 * Builds the Shared Image Gallery catalog of a region.
 *
 * <p>Implementations must be safe to call from many threads.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
@FunctionalInterface
public interface SigCatalogProvider {

  /**
   * Resolves the environment catalog for a selector and region.
   *
   * @param sigConfig the SIG selector, never null
   * @param region    the region, never null
   *
   * @return the environment catalog, never null
   *
   * @throws SigResolutionException if the environment cannot be built
   */
  SigAzureEnvironmentSpecConfig resolve(SigConfig sigConfig, String region);
}
