package com.example.casa.dto;

import java.util.function.ToDoubleFunction;

/**
 * CASA运动学参数
 */
public enum KinematicParameter {

    VCL("vcl", TrackKinematics::getVcl),
    VSL("vsl", TrackKinematics::getVsl),
    VAP("vap", TrackKinematics::getVap),
    LIN("lin", TrackKinematics::getLin),
    STR("str", TrackKinematics::getStr),
    WOB("wob", TrackKinematics::getWob),
    ALH("alh", TrackKinematics::getAlh),
    BCF("bcf", TrackKinematics::getBcf);

    private final String key;
    private final ToDoubleFunction<TrackKinematics> reader;

    KinematicParameter(String key, ToDoubleFunction<TrackKinematics> reader) {
        this.key = key;
        this.reader = reader;
    }

    public String getKey() {
        return key;
    }

    public double valueOf(TrackKinematics kinematics) {
        return reader.applyAsDouble(kinematics);
    }
}
