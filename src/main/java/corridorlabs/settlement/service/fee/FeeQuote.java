package corridorlabs.settlement.service.fee;

/**
 * Fee to apply to an immediate trade. {@code override == false} means the venue keeps its static fee.
 */
public record FeeQuote(int fee, boolean override) {

    /** Bit the venue reads to tell an override apart from "no override". */
    public static final int OVERRIDE_FEE_FLAG = 0x400000;

    public static final FeeQuote NO_OVERRIDE = new FeeQuote(0, false);

    public static FeeQuote override(int fee) {
        return new FeeQuote(fee, true);
    }

    public int encoded() {
        return override ? fee | OVERRIDE_FEE_FLAG : 0;
    }
}
