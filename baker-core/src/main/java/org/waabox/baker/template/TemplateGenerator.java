package org.waabox.baker.template;

import org.waabox.baker.datamodel.NodeBootstrappingConfiguration;

/**
 * Renders the boot payload and provisioning command of a node.
 *
 * <p>Implementations must be safe to call from many threads.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public interface TemplateGenerator {

  /**
   * Renders the boot payload (custom data) of a node.
   *
   * @param config the node configuration, never null
   *
   * @return the payload, never null
   */
  String bootPayload(NodeBootstrappingConfiguration config);

  /**
   * Renders the provisioning command of a node.
   *
   * @param config the node configuration, never null
   *
   * @return the command, never null
   */
  String provisioningCommand(NodeBootstrappingConfiguration config);
}
