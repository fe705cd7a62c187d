package com.venuearb.infra;

import com.venuearb.domain.FeeSchedule;

public interface FeeScheduleProvider {

    FeeSchedule fetch();
}
