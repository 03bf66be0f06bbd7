package io.github.jbellis.xmldoc.display;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * Options controlling how a resolved symbol's name and signature are rendered.
 * Instances are immutable; use the {@code with*} methods to derive variants.
 */
public record DisplayFormat(Qualification qualification, Set<MemberOption> memberOptions) {

    public enum Qualification {
        /** Just the simple name: {@code List}. */
        NAME_ONLY,
        /** Enclosing types but no namespace: {@code Outer.Inner}. */
        NAME_AND_CONTAINING_TYPES,
        /** Namespace and enclosing types: {@code System.Collections.Outer.Inner}. */
        FULLY_QUALIFIED
    }

    public enum MemberOption {
        INCLUDE_PARAMETERS,
        INCLUDE_EXPLICIT_INTERFACE,
        INCLUDE_CONTAINING_TYPE,
        INCLUDE_TYPE_PARAMETERS
    }

    /**
     * Format used when the caller supplies none: containing types, parameter lists and type parameters.
     */
    public static final DisplayFormat DEFAULT = new DisplayFormat(
            Qualification.NAME_AND_CONTAINING_TYPES,
            EnumSet.of(MemberOption.INCLUDE_CONTAINING_TYPE,
                       MemberOption.INCLUDE_PARAMETERS,
                       MemberOption.INCLUDE_TYPE_PARAMETERS));

    /**
     * Bare names, no member decoration. Suitable for compact tooltips.
     */
    public static final DisplayFormat SHORT = new DisplayFormat(Qualification.NAME_ONLY, Set.of());

    public DisplayFormat {
        Objects.requireNonNull(qualification, "qualification");
        Objects.requireNonNull(memberOptions, "memberOptions");
        memberOptions = memberOptions.isEmpty()
                        ? Collections.unmodifiableSet(EnumSet.noneOf(MemberOption.class))
                        : Collections.unmodifiableSet(EnumSet.copyOf(memberOptions));
    }

    /**
     * Returns a copy whose member options are exactly {@code options}; the previous set is discarded.
     */
    public DisplayFormat withMemberOptions(MemberOption... options) {
        var set = EnumSet.noneOf(MemberOption.class);
        Collections.addAll(set, options);
        return new DisplayFormat(qualification, set);
    }

    public DisplayFormat withQualification(Qualification newQualification) {
        return new DisplayFormat(newQualification, memberOptions);
    }

    public boolean has(MemberOption option) {
        return memberOptions.contains(option);
    }
}
