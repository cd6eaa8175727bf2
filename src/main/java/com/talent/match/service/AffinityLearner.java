package com.talent.match.service;

import com.talent.match.dto.AffinitySignals;
import com.talent.match.service.MarketplaceRecords.StudentHistory;

public interface AffinityLearner {
    AffinitySignals learn(StudentHistory history);
}
