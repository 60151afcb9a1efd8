package corridorlabs.settlement.event;

import java.math.BigInteger;

import lombok.Getter;
import org.springframework.context.ApplicationEvent;

/**
 * Published once per intent flipped to settled, by either settlement entry point.
 * The external settler pays {@code proposedOutput} to {@code owner}.
 */
@Getter
public class IntentSettledEvent extends ApplicationEvent {

    private final long intentId;
    private final String owner;
    private final String corridorId;
    private final BigInteger magnitude;
    private final BigInteger proposedOutput;

    public IntentSettledEvent(Object source, long intentId, String owner, String corridorId,
                              BigInteger magnitude, BigInteger proposedOutput) {
        super(source);
        this.intentId = intentId;
        this.owner = owner;
        this.corridorId = corridorId;
        this.magnitude = magnitude;
        this.proposedOutput = proposedOutput;
    }
}
