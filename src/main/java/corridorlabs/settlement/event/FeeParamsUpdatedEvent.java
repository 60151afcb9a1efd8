package corridorlabs.settlement.event;

import corridorlabs.settlement.state.FeeParams;
import lombok.Getter;
import org.springframework.context.ApplicationEvent;

@Getter
public class FeeParamsUpdatedEvent extends ApplicationEvent {

    private final String corridorId;
    private final FeeParams params;

    public FeeParamsUpdatedEvent(Object source, String corridorId, FeeParams params) {
        super(source);
        this.corridorId = corridorId;
        this.params = params;
    }
}
