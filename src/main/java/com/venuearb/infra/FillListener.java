package com.venuearb.infra;

import com.venuearb.domain.FillEvent;

public interface FillListener {

    void onFill(FillEvent event);
}
