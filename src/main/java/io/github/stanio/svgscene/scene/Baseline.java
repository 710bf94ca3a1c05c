/*
 * SPDX-FileCopyrightText: 2026 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.svgscene.scene;

/**
 * Vertical anchor of a text run relative to its placement origin.
 */
public enum Baseline { TOP, ALPHABETIC, BOTTOM, MID }
