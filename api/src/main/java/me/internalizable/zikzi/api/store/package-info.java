/**
 * Repository interfaces through which the gateway reads and writes its records.
 *
 * <p>The gateway only needs simple keyed lookups and equality/range filters:</p>
 * <ul>
 *   <li>{@link me.internalizable.zikzi.api.store.PrintJobRepository} - jobs created and advanced by the intake servers</li>
 *   <li>{@link me.internalizable.zikzi.api.store.UserRepository} - accounts for Basic/Digest authentication</li>
 *   <li>{@link me.internalizable.zikzi.api.store.IpRegistrationRepository} - address to user bindings</li>
 *   <li>{@link me.internalizable.zikzi.api.store.IppTokenRepository} - per-user printing tokens</li>
 * </ul>
 *
 * <p>Schema, migrations and the management of these records live outside the gateway.</p>
 */
package me.internalizable.zikzi.api.store;
