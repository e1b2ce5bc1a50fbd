package org.jstats.pitchlens_api.modules.dataset.model;

public interface ResultType {

    boolean isSuccess();
}
