package org.waabox.baker.datamodel;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * The distros known to the platform.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class Distros {

  public static final Distro AKS_UBUNTU_CONTAINERD_2204 =
      Distro.of("aks-ubuntu-containerd-22.04", OsFamily.UBUNTU);

  public static final Distro AKS_UBUNTU_CONTAINERD_2204_GEN2 =
      Distro.of("aks-ubuntu-containerd-22.04-gen2", OsFamily.UBUNTU);

  public static final Distro AKS_UBUNTU_ARM64_CONTAINERD_2204_GEN2 =
      Distro.of("aks-ubuntu-arm64-containerd-22.04-gen2", OsFamily.UBUNTU);

  public static final Distro AKS_UBUNTU_CONTAINERD_2404 =
      Distro.of("aks-ubuntu-containerd-24.04", OsFamily.UBUNTU);

  public static final Distro AKS_UBUNTU_CONTAINERD_2404_GEN2 =
      Distro.of("aks-ubuntu-containerd-24.04-gen2", OsFamily.UBUNTU);

  public static final Distro AKS_UBUNTU_FIPS_CONTAINERD_2004 =
      Distro.of("aks-ubuntu-fips-containerd-20.04", OsFamily.UBUNTU);

  public static final Distro AKS_CBL_MARINER_V2 =
      Distro.of("aks-cblmariner-v2", OsFamily.CBL_MARINER);

  public static final Distro AKS_CBL_MARINER_V2_GEN2 =
      Distro.of("aks-cblmariner-v2-gen2", OsFamily.CBL_MARINER);

  public static final Distro AKS_CBL_MARINER_V2_ARM64_GEN2 =
      Distro.of("aks-cblmariner-v2-arm64-gen2", OsFamily.CBL_MARINER);

  public static final Distro AKS_AZURE_LINUX_V2 =
      Distro.of("aks-azurelinux-v2", OsFamily.AZURE_LINUX);

  public static final Distro AKS_AZURE_LINUX_V2_GEN2 =
      Distro.of("aks-azurelinux-v2-gen2", OsFamily.AZURE_LINUX);

  public static final Distro AKS_AZURE_LINUX_V3_GEN2 =
      Distro.of("aks-azurelinux-v3-gen2", OsFamily.AZURE_LINUX);

  public static final Distro AKS_WINDOWS_2019_CONTAINERD =
      Distro.of("aks-windows-2019-containerd", OsFamily.WINDOWS);

  public static final Distro AKS_WINDOWS_2022_CONTAINERD =
      Distro.of("aks-windows-2022-containerd", OsFamily.WINDOWS);

  public static final Distro AKS_WINDOWS_2022_CONTAINERD_GEN2 =
      Distro.of("aks-windows-2022-containerd-gen2", OsFamily.WINDOWS);

  public static final Distro AKS_UBUNTU_EDGE_ZONE_CONTAINERD_2204 =
      Distro.of("aks-ubuntu-edgezone-containerd-22.04",
          OsFamily.UBUNTU_EDGE_ZONE);

  public static final Distro AKS_UBUNTU_EDGE_ZONE_CONTAINERD_2204_GEN2 =
      Distro.of("aks-ubuntu-edgezone-containerd-22.04-gen2",
          OsFamily.UBUNTU_EDGE_ZONE);

  public static final Distro CUSTOMIZED_WINDOWS_OS_IMAGE =
      Distro.customized("CustomizedWindowsOSImage", OsFamily.WINDOWS,
          CustomImageKind.WINDOWS);

  public static final Distro CUSTOMIZED_IMAGE =
      Distro.customized("CustomizedImage", OsFamily.UBUNTU,
          CustomImageKind.GENERIC);

  public static final Distro CUSTOMIZED_IMAGE_KATA =
      Distro.customized("CustomizedImageKata", OsFamily.UBUNTU,
          CustomImageKind.CONFIDENTIAL);

  /** Every known distro, keyed by name, in declaration order. */
  private static final Map<String, Distro> BY_NAME;

  static {
    final Map<String, Distro> byName = new LinkedHashMap<>();
    for (final Distro distro : List.of(
        AKS_UBUNTU_CONTAINERD_2204,
        AKS_UBUNTU_CONTAINERD_2204_GEN2,
        AKS_UBUNTU_ARM64_CONTAINERD_2204_GEN2,
        AKS_UBUNTU_CONTAINERD_2404,
        AKS_UBUNTU_CONTAINERD_2404_GEN2,
        AKS_UBUNTU_FIPS_CONTAINERD_2004,
        AKS_CBL_MARINER_V2,
        AKS_CBL_MARINER_V2_GEN2,
        AKS_CBL_MARINER_V2_ARM64_GEN2,
        AKS_AZURE_LINUX_V2,
        AKS_AZURE_LINUX_V2_GEN2,
        AKS_AZURE_LINUX_V3_GEN2,
        AKS_WINDOWS_2019_CONTAINERD,
        AKS_WINDOWS_2022_CONTAINERD,
        AKS_WINDOWS_2022_CONTAINERD_GEN2,
        AKS_UBUNTU_EDGE_ZONE_CONTAINERD_2204,
        AKS_UBUNTU_EDGE_ZONE_CONTAINERD_2204_GEN2,
        CUSTOMIZED_WINDOWS_OS_IMAGE,
        CUSTOMIZED_IMAGE,
        CUSTOMIZED_IMAGE_KATA)) {
      byName.put(distro.name(), distro);
    }
    BY_NAME = Collections.unmodifiableMap(byName);
  }

  /** Private constructor to prevent instantiation. */
  private Distros() {
    throw new UnsupportedOperationException("Utility class");
  }

  /**
   * Finds a known distro by its identifier.
   *
   * @param name the distro identifier, never null
   *
   * @return the distro, or empty if the name is unknown
   */
  public static Optional<Distro> byName(final String name) {
    Objects.requireNonNull(name, "name must not be null");
    return Optional.ofNullable(BY_NAME.get(name));
  }

  /**
   * Returns every known distro in declaration order.
   *
   * @return the distros, never null, unmodifiable
   */
  public static List<Distro> all() {
    return List.copyOf(BY_NAME.values());
  }
}
