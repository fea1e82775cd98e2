package org.waabox.baker.datamodel;

/**
 * The classes of customer supplied images.
 *
 * <p>A distro carrying one of these kinds boots from an image the platform
 * does not publish, so it is never looked up in any catalog.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public enum CustomImageKind {

  /** A customer supplied Windows image. */
  WINDOWS,

  /** A customer supplied Linux image. */
  GENERIC,

  /** A customer supplied confidential computing (kata) image. */
  CONFIDENTIAL
}
