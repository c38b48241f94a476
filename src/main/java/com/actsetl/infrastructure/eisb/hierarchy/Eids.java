package com.actsetl.infrastructure.eisb.hierarchy;

/**
 * Builds element identifiers following the Akoma Ntoso naming convention:
 * lowercase ASCII letters, digits, '-' and '_' only, with levels joined by '_'.
 */
public final class Eids {

    private Eids() {
    }

    /**
     * Local identifier fragment, e.g. {@code ("subsect", "(1A)")} gives {@code subsect_1a}.
     */
    public static String snippet(String label, String number) {
        StringBuilder filtered = new StringBuilder();
        for (char c : number.toCharArray()) {
            if (isAllowed(c)) {
                filtered.append(Character.toLowerCase(c));
            }
        }
        return label + "_" + filtered;
    }

    /**
     * Joins a parent identifier and a local fragment. Either may be missing; with no
     * local fragment there is no identifier.
     */
    public static String join(String parentEid, String childEid) {
        if (childEid == null || childEid.isEmpty()) {
            return null;
        }
        if (parentEid == null || parentEid.isEmpty()) {
            return childEid;
        }
        return parentEid + "_" + childEid;
    }

    public static String mod(String sectionEid, int counter) {
        return sectionEid + "_mod_" + counter;
    }

    public static String quotedStructure(String modEid) {
        return modEid + "_qstr";
    }

    private static boolean isAllowed(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || (c >= '0' && c <= '9') || c == '-' || c == '_';
    }
}
