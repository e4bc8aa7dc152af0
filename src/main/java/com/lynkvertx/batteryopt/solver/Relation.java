package com.lynkvertx.batteryopt.solver;

/** Relation between the left-hand linear expression and the right-hand constant */
public enum Relation {
    EQ,
    LEQ,
    GEQ
}
