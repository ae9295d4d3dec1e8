package dumb.calculi;

import dumb.calculi.util.Log;
import org.jetbrains.annotations.Nullable;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static java.util.Objects.requireNonNull;

/**
 * Premises and conclusions, each a formula or a lower-level inference. An inference whose
 * members are formulas has level 1; one whose members are level-n inferences has level n+1.
 */
public final class Inference implements Claim {

    public final List<Claim> premises;
    public final List<Claim> conclusions;
    private final int level;

    public Inference(List<? extends Claim> premises, List<? extends Claim> conclusions) {
        this(premises, conclusions, null);
    }

    /**
     * @param level declared level; required to place an empty inference above level 1
     * @throws IncorrectLevelsException if the declared level contradicts the members
     */
    public Inference(List<? extends Claim> premises, List<? extends Claim> conclusions, @Nullable Integer level) {
        this.premises = List.copyOf(premises);
        this.conclusions = List.copyOf(conclusions);
        this.level = level(this.premises, this.conclusions, level);
    }

    private static int level(List<Claim> premises, List<Claim> conclusions, @Nullable Integer declared) {
        if (premises.isEmpty() && conclusions.isEmpty())
            return declared != null ? declared : 1;

        var natural = (conclusions.isEmpty() ? premises.get(0) : conclusions.get(0)).level() + 1;
        var mixed = Stream.concat(premises.stream(), conclusions.stream()).anyMatch(c -> c.level() != natural - 1);

        if (declared != null && declared != natural)
            throw new IncorrectLevelsException("Declared level " + declared + " does not match the level " + natural
                    + " of " + kif(premises, conclusions));
        if (mixed)
            Log.warning("Inference " + kif(premises, conclusions) + " mixes members of different levels; taking level " + natural);
        return natural;
    }

    private static String kif(List<Claim> premises, List<Claim> conclusions) {
        return "(inference " + list(premises) + " " + list(conclusions) + ")";
    }

    private static String list(List<Claim> claims) {
        return claims.stream().map(Claim::toKif).collect(Collectors.joining(" ", "(", ")"));
    }

    @Override
    public int level() {
        return level;
    }

    public boolean isEmpty() {
        return premises.isEmpty() && conclusions.isEmpty();
    }

    public boolean isSchematic() {
        return Stream.concat(premises.stream(), conclusions.stream()).anyMatch(Inference::schematic);
    }

    private static boolean schematic(Claim c) {
        return c instanceof Formula f ? f.isSchematic() : ((Inference) c).isSchematic();
    }

    @Override
    public String toKif() {
        var s = kif(premises, conclusions);
        return isEmpty() && level != 1 ? s.substring(0, s.length() - 1) + " " + level + ")" : s;
    }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof Inference i && level == i.level
                && premises.equals(i.premises) && conclusions.equals(i.conclusions));
    }

    @Override
    public int hashCode() {
        return Objects.hash(premises, conclusions, level);
    }

    @Override
    public String toString() {
        return toKif();
    }

    /** Raised when a declared inference level contradicts its members. */
    public static class IncorrectLevelsException extends IllegalArgumentException {
        public IncorrectLevelsException(String message) {
            super(requireNonNull(message));
        }
    }
}
