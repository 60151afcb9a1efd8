package corridorlabs.settlement.event;

import corridorlabs.settlement.dto.settlement.CowStats;
import lombok.Getter;
import org.springframework.context.ApplicationEvent;

/**
 * Aggregate signal for a batch that actually netted opposing flow.
 */
@Getter
public class BatchSettledEvent extends ApplicationEvent {

    private final String corridorId;
    private final CowStats stats;

    public BatchSettledEvent(Object source, String corridorId, CowStats stats) {
        super(source);
        this.corridorId = corridorId;
        this.stats = stats;
    }
}
