package org.Aayush.wfst.properties;

/**
 * Structural property bits of an automaton.
 *
 * <p>Properties come in complementary pairs ({@link #ACCEPTOR} / {@link #NOT_ACCEPTOR}, ...). A
 * computed property word always has exactly one bit of every pair set. Bit positions follow the
 * reference binary format so the word can be written to disk unchanged.</p>
 */
public final class FstProperties {
    public static final long ACCEPTOR = 0x10000L;
    public static final long NOT_ACCEPTOR = 0x20000L;
    public static final long I_DETERMINISTIC = 0x40000L;
    public static final long NON_I_DETERMINISTIC = 0x80000L;
    public static final long O_DETERMINISTIC = 0x100000L;
    public static final long NON_O_DETERMINISTIC = 0x200000L;
    public static final long EPSILONS = 0x400000L;
    public static final long NO_EPSILONS = 0x800000L;
    public static final long I_EPSILONS = 0x1000000L;
    public static final long NO_I_EPSILONS = 0x2000000L;
    public static final long O_EPSILONS = 0x4000000L;
    public static final long NO_O_EPSILONS = 0x8000000L;
    public static final long I_LABEL_SORTED = 0x10000000L;
    public static final long NOT_I_LABEL_SORTED = 0x20000000L;
    public static final long O_LABEL_SORTED = 0x40000000L;
    public static final long NOT_O_LABEL_SORTED = 0x80000000L;
    public static final long WEIGHTED = 0x100000000L;
    public static final long UNWEIGHTED = 0x200000000L;
    public static final long CYCLIC = 0x400000000L;
    public static final long ACYCLIC = 0x800000000L;
    public static final long INITIAL_CYCLIC = 0x1000000000L;
    public static final long INITIAL_ACYCLIC = 0x2000000000L;
    public static final long TOP_SORTED = 0x4000000000L;
    public static final long NOT_TOP_SORTED = 0x8000000000L;
    public static final long ACCESSIBLE = 0x10000000000L;
    public static final long NOT_ACCESSIBLE = 0x20000000000L;
    public static final long COACCESSIBLE = 0x40000000000L;
    public static final long NOT_COACCESSIBLE = 0x80000000000L;
    public static final long STRING = 0x100000000000L;
    public static final long NOT_STRING = 0x200000000000L;
    public static final long WEIGHTED_CYCLES = 0x400000000000L;
    public static final long UNWEIGHTED_CYCLES = 0x800000000000L;

    /** Every property bit. */
    public static final long ALL = 0xFFFFFFFF0000L;

    private FstProperties() {
    }

    /**
     * Renders the set bits as a comma separated list of property names.
     */
    public static String describe(long props) {
        StringBuilder sb = new StringBuilder();
        String[] names = {
                "acceptor", "not_acceptor", "i_deterministic", "non_i_deterministic",
                "o_deterministic", "non_o_deterministic", "epsilons", "no_epsilons",
                "i_epsilons", "no_i_epsilons", "o_epsilons", "no_o_epsilons",
                "i_label_sorted", "not_i_label_sorted", "o_label_sorted", "not_o_label_sorted",
                "weighted", "unweighted", "cyclic", "acyclic",
                "initial_cyclic", "initial_acyclic", "top_sorted", "not_top_sorted",
                "accessible", "not_accessible", "coaccessible", "not_coaccessible",
                "string", "not_string", "weighted_cycles", "unweighted_cycles"
        };
        for (int i = 0; i < names.length; i++) {
            if ((props & (ACCEPTOR << i)) != 0) {
                if (sb.length() > 0) {
                    sb.append(',');
                }
                sb.append(names[i]);
            }
        }
        return sb.toString();
    }
}
