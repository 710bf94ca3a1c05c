/*
 * SPDX-FileCopyrightText: 2026 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.svgscene.scene;

/**
 * Image scaling policy when the requested size differs from the intrinsic
 * one: {@code NONE} stretches, {@code MEET} fits inside, {@code SLICE}
 * covers.
 */
public enum AspectRatio { NONE, MEET, SLICE }
