package corridorlabs.settlement.dto.settlement;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Parallel lists: {@code proposedOutputs[i]} is the output offered for {@code intentIds[i]}.
 * Shape errors are reported by the netting engine with their own codes.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class SettleBatchRequest {

    private List<Long> intentIds = new ArrayList<>();

    private List<BigInteger> proposedOutputs = new ArrayList<>();
}
