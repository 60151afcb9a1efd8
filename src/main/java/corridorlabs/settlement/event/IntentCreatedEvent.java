package corridorlabs.settlement.event;

import java.math.BigInteger;

import corridorlabs.settlement.dto.intent.IntentDirection;
import lombok.Getter;
import org.springframework.context.ApplicationEvent;

/**
 * Published when the ledger records a new deferred-mode intent.
 */
@Getter
public class IntentCreatedEvent extends ApplicationEvent {

    private final long intentId;
    private final String owner;
    private final String corridorId;
    private final IntentDirection direction;
    private final BigInteger magnitude;
    private final BigInteger minOut;
    private final long deadline;

    public IntentCreatedEvent(
        Object source,
        long intentId,
        String owner,
        String corridorId,
        IntentDirection direction,
        BigInteger magnitude,
        BigInteger minOut,
        long deadline
    ) {
        super(source);
        this.intentId = intentId;
        this.owner = owner;
        this.corridorId = corridorId;
        this.direction = direction;
        this.magnitude = magnitude;
        this.minOut = minOut;
        this.deadline = deadline;
    }
}
