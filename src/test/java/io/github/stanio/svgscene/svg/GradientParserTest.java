/*
 * SPDX-FileCopyrightText: 2026 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.svgscene.svg;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import java.util.Optional;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestInstance;
import org.junit.jupiter.api.TestInstance.Lifecycle;

import org.assertj.core.api.InstanceOfAssertFactories;

import io.github.stanio.svgscene.geom.Transform;
import io.github.stanio.svgscene.markup.DomMarkup;
import io.github.stanio.svgscene.paint.Color;
import io.github.stanio.svgscene.paint.Fill;
import io.github.stanio.svgscene.paint.LinearGradient;
import io.github.stanio.svgscene.paint.RadialGradient;
import io.github.stanio.svgscene.paint.Stop;

@TestInstance(Lifecycle.PER_CLASS)
public class GradientParserTest {

    private DefinitionRegistry definitions;

    private GradientParser parser;

    @BeforeEach
    void setUp() {
        definitions = new DefinitionRegistry();
        Diagnostics diagnostics = Diagnostics.logOnly();
        parser = new GradientParser(definitions,
                new TransformParser(diagnostics), diagnostics);
    }

    private Optional<Fill> parse(String element) throws Exception {
        return parser.parse(DomMarkup.parse(element));
    }

    private LinearGradient linear(String element) throws Exception {
        return parse(element).map(LinearGradient.class::cast).orElseThrow();
    }

    @Test
    void singleStopIsColor() throws Exception {
        assertThat(parse("<linearGradient>"
                + "<stop offset='0' stop-color='#ff0000'/>"
                + "</linearGradient>"))
                .as("fill")
                .contains(Color.rgb(255, 0, 0));
    }

    @Test
    void noStops() throws Exception {
        assertThat(parse("<radialGradient/>")).as("fill").isEmpty();
    }

    @Test
    void offsetsClamped() throws Exception {
        LinearGradient gradient = linear("<linearGradient>"
                + "<stop offset='-10%' stop-color='red'/>"
                + "<stop offset='150%' stop-color='blue'/>"
                + "</linearGradient>");

        assertThat(gradient.stops()).extracting(Stop::offset)
                                    .as("offsets")
                                    .containsExactly(0.0, 1.0);
    }

    @Test
    void stopWithoutOffsetSkipped() throws Exception {
        LinearGradient gradient = linear("<linearGradient>"
                + "<stop stop-color='red'/>"
                + "<stop offset='0.2'/>"
                + "<stop offset='0.7' stop-color='white'/>"
                + "</linearGradient>");

        assertThat(gradient.stops()).as("stops")
                                    .containsExactly(new Stop(0.2, Color.BLACK),
                                                     new Stop(0.7, Color.WHITE));
    }

    @Test
    void stopStyle() throws Exception {
        LinearGradient gradient = linear("<linearGradient>"
                + "<stop offset='0' style='stop-color:#0000ff;stop-opacity:0.5'/>"
                + "<stop offset='1' stop-color='#fff' stop-opacity='0'/>"
                + "</linearGradient>");

        assertThat(gradient.stops()).extracting(Stop::color)
                                    .as("colors")
                                    .containsExactly(Color.rgba(0, 0, 255, 0.5),
                                                     Color.rgba(255, 255, 255, 0));
    }

    @Test
    void linearDefaults() throws Exception {
        LinearGradient gradient = linear("<linearGradient y2='50%'>"
                + "<stop offset='0'/><stop offset='1'/>"
                + "</linearGradient>");

        assertThat(gradient).extracting(LinearGradient::x1, LinearGradient::y1,
                                        LinearGradient::x2, LinearGradient::y2,
                                        LinearGradient::userSpace,
                                        LinearGradient::transform)
                            .as("LinearGradient(x1, y1, x2, y2, userSpace, transform)")
                            .containsExactly(0.0, 0.0, 1.0, 0.5, false, Transform.IDENTITY);
    }

    @Test
    void radialFocusDefaultsToCenter() throws Exception {
        Fill fill = parse("<radialGradient cx='0.25' cy='30%'"
                + " gradientUnits='userSpaceOnUse' gradientTransform='scale(2)'>"
                + "<stop offset='0'/><stop offset='1'/>"
                + "</radialGradient>").orElseThrow();

        assertThat(fill).asInstanceOf(InstanceOfAssertFactories.type(RadialGradient.class))
                .extracting(RadialGradient::cx, RadialGradient::cy,
                            RadialGradient::fx, RadialGradient::fy,
                            RadialGradient::r, RadialGradient::userSpace,
                            RadialGradient::transform)
                .as("RadialGradient(cx, cy, fx, fy, r, userSpace, transform)")
                .containsExactly(0.25, 0.3, 0.25, 0.3, 0.5, true, Transform.scaling(2, 2));
    }

    @Test
    void inheritsFromParent() throws Exception {
        LinearGradient parent = new LinearGradient(0, 0, 0.5, 0, true,
                List.of(new Stop(0, Color.WHITE), new Stop(1, Color.BLACK)));
        definitions.putFill("base", parent);

        LinearGradient gradient = linear("<linearGradient xlink:href='#base' y2='1'/>");

        assertThat(gradient).extracting(LinearGradient::stops,
                                        LinearGradient::x2, LinearGradient::y2,
                                        LinearGradient::userSpace)
                            .as("LinearGradient(stops, x2, y2, userSpace)")
                            .containsExactly(parent.stops(), 0.5, 1.0, true);
    }

    @Test
    void ownStopsOverrideParent() throws Exception {
        definitions.putFill("base", new LinearGradient(0, 0, 1, 0, false,
                List.of(new Stop(0, Color.WHITE), new Stop(1, Color.BLACK))));

        assertThat(parse("<linearGradient href='#base'>"
                + "<stop offset='0' stop-color='lime'/>"
                + "</linearGradient>"))
                .as("fill")
                .contains(Color.rgb(0, 255, 0));
    }

    @Test
    void radialFromLinearParentKeepsStops() throws Exception {
        LinearGradient parent = new LinearGradient(0.1, 0.2, 0.3, 0.4, false,
                List.of(new Stop(0, Color.WHITE), new Stop(1, Color.BLACK)));
        definitions.putFill("base", parent);

        Fill fill = parse("<radialGradient xlink:href='#base'/>").orElseThrow();

        assertThat(fill).as("fill")
                .asInstanceOf(InstanceOfAssertFactories.type(RadialGradient.class))
                .extracting(RadialGradient::stops, RadialGradient::cx, RadialGradient::r)
                .containsExactly(parent.stops(), 0.5, 0.5);
    }

    @Test
    void unresolvedParent() throws Exception {
        assertThat(parse("<linearGradient xlink:href='#missing'/>"))
                .as("fill").isEmpty();
    }

    @Test
    void gradientNames() throws Exception {
        assertThat(GradientParser.isGradient(DomMarkup.parse("<linearGradient/>")))
                .as("linearGradient").isTrue();
        assertThat(GradientParser.isGradient(DomMarkup.parse("<mask/>")))
                .as("mask").isFalse();
    }

}
