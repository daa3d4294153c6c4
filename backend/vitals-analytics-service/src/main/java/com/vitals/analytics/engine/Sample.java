package com.vitals.analytics.engine;

import java.time.Instant;

record Sample(double value, Instant arrivedAt) {}
