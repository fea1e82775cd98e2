package org.waabox.baker.datamodel;

/**
 * The operating system flag of an agent pool.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public enum OsType {

  /** Linux nodes. */
  LINUX,

  /** Windows nodes. */
  WINDOWS
}
