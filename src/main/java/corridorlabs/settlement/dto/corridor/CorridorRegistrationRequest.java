package corridorlabs.settlement.dto.corridor;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class CorridorRegistrationRequest {

    private boolean nettable = true;
}
