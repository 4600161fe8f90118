package com.vtb.nessus.models;

import lombok.Value;

/**
 * Пара (метка, количество) для гистограмм и графиков
 */
@Value(staticConstructor = "of")
public class LabelCount {
    String label;
    int count;
}
