package corridorlabs.settlement.event;

import java.math.BigInteger;

import lombok.Getter;
import org.springframework.context.ApplicationEvent;

@Getter
public class FlowResetEvent extends ApplicationEvent {

    private final String corridorId;
    private final BigInteger previousFlow;
    private final String resetBy;

    public FlowResetEvent(Object source, String corridorId, BigInteger previousFlow, String resetBy) {
        super(source);
        this.corridorId = corridorId;
        this.previousFlow = previousFlow;
        this.resetBy = resetBy;
    }
}
