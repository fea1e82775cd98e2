package org.waabox.baker.datamodel;

import java.util.Objects;

/**
 * The cluster a node joins.
 *
 * @param name     the cluster name, never null
 * @param location the region the cluster is deployed to, never null
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record ContainerService(String name, String location) {

  /**
   * Creates a new cluster descriptor.
   *
   * @throws NullPointerException if any argument is null
   */
  public ContainerService {
    Objects.requireNonNull(name, "name must not be null");
    Objects.requireNonNull(location, "location must not be null");
  }
}
