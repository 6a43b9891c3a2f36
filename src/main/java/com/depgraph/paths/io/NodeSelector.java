package com.depgraph.paths.io;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Resolves a selector string to the node addresses it names.
 *
 * <p>
 * Addresses have the form {@code dir/sub:name}. Supported selectors:
 * <ul>
 * <li>{@code dir/sub:name}: that exact address.</li>
 * <li>{@code dir/sub:}: every node directly in {@code dir/sub}.</li>
 * <li>{@code dir::}: every node in {@code dir} or below it; {@code ::} alone
 * matches everything.</li>
 * </ul>
 * Matches keep the order of the candidate collection. Matching nothing is not
 * an error.
 */
public final class NodeSelector {
    private NodeSelector() {
        // Utility class
    }

    public static List<String> select(String selector, Collection<String> addresses) {
        String s = selector.trim();
        List<String> out = new ArrayList<>();
        if (s.endsWith("::")) {
            String prefix = s.substring(0, s.length() - 2);
            for (String address : addresses) {
                String dir = directoryOf(address);
                if (prefix.isEmpty() || dir.equals(prefix) || dir.startsWith(prefix + "/"))
                    out.add(address);
            }
        } else if (s.endsWith(":")) {
            String dir = s.substring(0, s.length() - 1);
            for (String address : addresses) {
                if (directoryOf(address).equals(dir))
                    out.add(address);
            }
        } else {
            for (String address : addresses) {
                if (address.equals(s))
                    out.add(address);
            }
        }
        return out;
    }

    /** The part of an address before its last ':', or the whole address. */
    static String directoryOf(String address) {
        int colon = address.lastIndexOf(':');
        return colon < 0 ? address : address.substring(0, colon);
    }
}
