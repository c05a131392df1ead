/**
 * HAProxy PROXY protocol support for the raw PostScript listener.
 *
 * <p>Raw print jobs are attributed by client address, so a TCP load balancer in front of
 * the gateway must pass the original address along. This package decodes PROXY protocol
 * v1 and v2 preambles.</p>
 *
 * <h2>Key Components</h2>
 * <ul>
 *   <li>{@link me.internalizable.zikzi.pipeline.proxy.ProxyProtocolPolicy} - per-connection decision</li>
 *   <li>{@link me.internalizable.zikzi.pipeline.proxy.ProxyProtocolHandler} - decodes the header</li>
 *   <li>{@link me.internalizable.zikzi.pipeline.proxy.ProxyProtocolEvent} - tells downstream handlers the preamble is done</li>
 * </ul>
 *
 * <h2>Usage</h2>
 * <pre>
 * printer:
 *   proxyProtocol:
 *     enabled: true
 *     headerTimeoutSeconds: 10
 *     trustedProxies:
 *       - "10.0.0.0/8"
 * </pre>
 *
 * <h2>Security Considerations</h2>
 * <p><b>WARNING:</b> with an empty trusted list every connection must carry a header. Leave
 * the feature disabled unless all raw traffic passes through a proxy that sends one,
 * otherwise any client could claim a registered address.</p>
 *
 * @see <a href="https://www.haproxy.org/download/2.0/doc/proxy-protocol.txt">PROXY Protocol Specification</a>
 */
package me.internalizable.zikzi.pipeline.proxy;
