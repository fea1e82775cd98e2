package org.waabox.baker.overrides;

import java.util.Collections;
import java.util.Map;

/**
 * An {@link OverrideStore} without overrides.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public class NoopOverrideStore implements OverrideStore {

  /** {@inheritDoc} */
  @Override
  public Map<String, String> linuxNodeImageVersions(
      final OverrideEntity entity) {
    return Collections.emptyMap();
  }
}
