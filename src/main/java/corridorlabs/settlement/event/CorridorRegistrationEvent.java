package corridorlabs.settlement.event;

import lombok.Getter;
import org.springframework.context.ApplicationEvent;

@Getter
public class CorridorRegistrationEvent extends ApplicationEvent {

    private final String corridorId;
    private final boolean nettable;

    public CorridorRegistrationEvent(Object source, String corridorId, boolean nettable) {
        super(source);
        this.corridorId = corridorId;
        this.nettable = nettable;
    }
}
