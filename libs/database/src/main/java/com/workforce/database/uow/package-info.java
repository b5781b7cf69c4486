/**
 * Unit of work over Spring JDBC.
 *
 * <p>Entities are plain objects described by an {@link com.workforce.database.uow.EntityMapping};
 * changes are detected by comparing column snapshots rather than through proxies.
 */
package com.workforce.database.uow;
