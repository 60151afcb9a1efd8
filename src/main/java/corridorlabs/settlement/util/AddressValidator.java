package corridorlabs.settlement.util;

import java.util.Locale;
import java.util.regex.Pattern;

import org.web3j.crypto.Keys;
import org.web3j.utils.Numeric;

/**
 * Validation and normalisation of EVM-style owner addresses.
 */
public final class AddressValidator {

    public static final String ZERO_ADDRESS = "0x0000000000000000000000000000000000000000";

    private static final Pattern ADDRESS_PATTERN = Pattern.compile("^0x[0-9a-fA-F]{40}$");

    private AddressValidator() {
    }

    /**
     * Accepts lowercase addresses and mixed-case addresses whose EIP-55 checksum matches.
     */
    public static boolean isValidAddress(String address) {
        if (address == null || !ADDRESS_PATTERN.matcher(address).matches()) {
            return false;
        }
        String body = address.substring(2);
        if (body.equals(body.toLowerCase(Locale.ROOT))) {
            return true;
        }
        return Keys.toChecksumAddress(address.toLowerCase(Locale.ROOT)).equals(address);
    }

    public static boolean isZeroAddress(String address) {
        return address != null && isValidAddress(address) && Numeric.toBigInt(address).signum() == 0;
    }

    /**
     * Lowercase canonical form used as map key for owner indexes and admin lookups.
     *
     * @throws IllegalArgumentException if the address is malformed
     */
    public static String normalize(String address) {
        if (!isValidAddress(address)) {
            throw new IllegalArgumentException("Invalid address: " + LogSanitizer.sanitize(address));
        }
        return address.toLowerCase(Locale.ROOT);
    }
}
