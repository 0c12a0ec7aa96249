package com.anomalyhunter.mapper;

import com.anomalyhunter.api.dto.response.FindingResponse;
import com.anomalyhunter.api.dto.response.VerdictResponse;
import com.anomalyhunter.domain.enums.StrategyId;
import com.anomalyhunter.domain.model.Finding;
import com.anomalyhunter.domain.model.Verdict;
import java.util.List;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;

/**
 * MapStruct mapper between the Verdict domain model and its REST DTO.
 *
 * <p>Strategies are exposed by their persisted key rather than the enum name, so REST
 * payloads, metric tags and stored learning state all use the same identifier.
 */
@Mapper
public interface VerdictMapper {

    @Mapping(target = "recommendedAction", source = "recommendation.action")
    VerdictResponse toResponse(Verdict verdict);

    List<VerdictResponse> toResponseList(List<Verdict> verdicts);

    @Mapping(target = "strategy", source = "strategyId")
    FindingResponse toResponse(Finding finding);

    default String strategyKey(StrategyId strategyId) {
        return strategyId == null ? null : strategyId.getKey();
    }
}
