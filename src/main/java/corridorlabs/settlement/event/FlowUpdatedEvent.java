package corridorlabs.settlement.event;

import java.math.BigInteger;

import lombok.Getter;
import org.springframework.context.ApplicationEvent;

@Getter
public class FlowUpdatedEvent extends ApplicationEvent {

    private final String corridorId;
    private final BigInteger previousFlow;
    private final BigInteger currentFlow;

    public FlowUpdatedEvent(Object source, String corridorId, BigInteger previousFlow, BigInteger currentFlow) {
        super(source);
        this.corridorId = corridorId;
        this.previousFlow = previousFlow;
        this.currentFlow = currentFlow;
    }
}
