// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.thor.core.rlp;

import java.util.Objects;

/**
 * A named {@link Kind}. Struct and array profiles nest to describe a whole wire
 * layout; the name becomes one segment of the error path.
 *
 * @param name field name
 * @param kind field kind
 */
public record Profile(String name, Kind kind) {

    public Profile {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(kind, "kind");
    }

    public static Profile of(final String name, final Kind kind) {
        return new Profile(name, kind);
    }
}
