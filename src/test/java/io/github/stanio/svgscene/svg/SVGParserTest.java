/*
 * SPDX-FileCopyrightText: 2026 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.svgscene.svg;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.stream.Collectors;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestInstance;
import org.junit.jupiter.api.TestInstance.Lifecycle;
import org.junit.jupiter.api.io.TempDir;

import io.github.stanio.svgscene.geom.Arc;
import io.github.stanio.svgscene.geom.Ellipse;
import io.github.stanio.svgscene.geom.Line;
import io.github.stanio.svgscene.geom.Polygon;
import io.github.stanio.svgscene.geom.Rect;
import io.github.stanio.svgscene.geom.RoundRect;
import io.github.stanio.svgscene.geom.Transform;
import io.github.stanio.svgscene.markup.MarkupException;
import io.github.stanio.svgscene.paint.Color;
import io.github.stanio.svgscene.scene.Group;
import io.github.stanio.svgscene.scene.Image;
import io.github.stanio.svgscene.scene.SceneNode;
import io.github.stanio.svgscene.scene.SceneNodes;
import io.github.stanio.svgscene.scene.Shape;

@TestInstance(Lifecycle.PER_CLASS)
public class SVGParserTest {

    private static final String RESOURCE_BASE = "io/github/stanio/svgscene/svg/";

    private static final Color RED = Color.rgb(255, 0, 0);
    private static final Color BLUE = Color.rgb(0, 0, 255);

    private final List<Diagnostic> problems = new ArrayList<>();

    private SVGParser parser;

    @BeforeEach
    void setUp() {
        problems.clear();
        parser = SVGParser.builder().diagnostics(problems::add).build();
    }

    private Group resource(String name) throws IOException {
        return parser.parse(getClass().getClassLoader(), RESOURCE_BASE + name);
    }

    private List<Diagnostic> warnings() {
        return problems.stream()
                .filter(problem -> problem.level() == Level.WARNING)
                .collect(Collectors.toList());
    }

    private static Shape shape(SceneNode node) {
        assertThat(node).as("node").isInstanceOf(Shape.class);
        return (Shape) node;
    }

    private static Color fillColor(SceneNode node) {
        return (Color) shape(node).fill().orElseThrow();
    }

    @Test
    void redRect() throws Exception {
        Group scene = parser.parse("<svg><rect x='1' y='2' width='3' height='4'"
                + " fill='red'/></svg>");

        assertThat(scene.contents()).as("contents").hasSize(1);
        Shape rect = shape(scene.contents().get(0));
        assertThat(rect.form()).as("form").isEqualTo(new Rect(1, 2, 3, 4));
        assertThat(rect.fill()).as("fill").contains(RED);
        assertThat(rect.stroke()).as("stroke").isEmpty();
        assertThat(scene.place()).as("scene place").isEqualTo(Transform.IDENTITY);
        assertThat(problems).as("problems").isEmpty();
    }

    @Test
    void basicShapes() throws Exception {
        List<SceneNode> contents = resource("shapes").contents();

        assertThat(contents).as("contents").hasSize(6);
        assertThat(shape(contents.get(0)))
                .extracting(Shape::form, SceneNode::tags)
                .as("rect(form, tags)")
                .containsExactly(new Rect(1, 2, 10, 20), List.of("box"));
        assertThat(shape(contents.get(1)).form()).as("ellipse")
                .isEqualTo(new Arc(new Ellipse(5, 6, 3, 2), 0, 2 * Math.PI));
        assertThat(shape(contents.get(2)).form()).as("rounded rect")
                .isEqualTo(new RoundRect(new Rect(0, 0, 4, 4), 1, 1));
        assertThat(shape(contents.get(3)).form()).as("polygon")
                .isEqualTo(new Polygon(0, 0, 4, 0, 4, 4));
        assertThat(shape(contents.get(4)))
                .satisfies(line -> {
                    assertThat(line.form()).as("line").isEqualTo(new Line(0, 0, 7, 0));
                    assertThat(line.stroke()).as("line stroke").isPresent();
                });
        assertThat(contents.get(5)).as("image").isInstanceOf(Image.class);
        assertThat((Image) contents.get(5))
                .extracting(Image::src, Image::w, Image::h,
                            Image::place, Image::opacity)
                .as("Image(src, w, h, place, opacity)")
                .containsExactly("pic.png", 8.0, 9.0,
                                 Transform.translation(2, 3), 0.5);
    }

    @Test
    void nestedSvgIsHoisted() throws Exception {
        Group scene = parser.parse("<svg><svg fill='red'>"
                + "<rect width='1' height='1'/>"
                + "<svg><rect width='2' height='2' fill='blue'/></svg>"
                + "</svg></svg>");

        assertThat(scene.contents()).extracting(SVGParserTest::fillColor)
                                    .as("hoisted fills")
                                    .containsExactly(RED, BLUE);
    }

    @Test
    void groupStyleCascades() throws Exception {
        Group scene = parser.parse("<svg><g id='grp' transform='translate(1,2)'"
                + " opacity='0.5' fill='blue'>"
                + "<rect width='1' height='1'/>"
                + "<rect width='1' height='1' fill='red' opacity='1'/>"
                + "</g></svg>");

        Group group = (Group) scene.contents().get(0);
        assertThat(group).extracting(Group::place, Group::opacity, Group::tags)
                         .as("Group(place, opacity, tags)")
                         .containsExactly(Transform.translation(1, 2), 1.0,
                                          List.of("grp"));
        assertThat(group.contents())
                .extracting(SVGParserTest::fillColor, SceneNode::opacity)
                .as("children(fill, opacity)")
                .containsExactly(tuple(BLUE, 0.5), tuple(RED, 1.0));
    }

    @Test
    void useInstancesAreIndependent() throws Exception {
        List<SceneNode> contents = resource("use").contents();

        assertThat(contents).as("contents").hasSize(4);
        Group first = (Group) contents.get(0);
        Group second = (Group) contents.get(1);
        assertThat(first.contents()).extracting(SVGParserTest::fillColor)
                                    .as("first instance fills")
                                    .containsExactly(RED, RED);
        assertThat(second.contents()).extracting(SVGParserTest::fillColor)
                                     .as("second instance fills")
                                     .containsExactly(BLUE, BLUE);
        assertThat(second.place()).as("second instance place")
                                  .isEqualTo(Transform.translation(10, 0));
        assertThat(SceneNodes.count(first)).as("instance node count").isEqualTo(3);

        ((Shape) first.contents().get(0)).setFill(Color.WHITE);
        assertThat(second.contents()).extracting(SVGParserTest::fillColor)
                                     .as("second instance fills after change")
                                     .containsExactly(BLUE, BLUE);
    }

    @Test
    void singleStopGradientIsColor() throws Exception {
        SceneNode rect = resource("use").contents().get(2);

        assertThat(fillColor(rect)).as("fill").isEqualTo(Color.rgb(0, 255, 0));
    }

    @Test
    void maskBecomesClip() throws Exception {
        Shape rect = shape(resource("use").contents().get(3));

        assertThat(rect.clip()).as("clip")
                .contains(new Arc(new Ellipse(5, 5, 5, 5), 0, 2 * Math.PI));
        assertThat(rect.fill()).as("fill").isEmpty();
    }

    @Test
    void unsupportedElementReported() throws Exception {
        resource("use");

        assertThat(warnings()).extracting(Diagnostic::element, Diagnostic::message)
                              .as("warnings")
                              .containsExactly(tuple("blink", "Unsupported element skipped"));
    }

    @Test
    void degenerateShapesSkipped() throws Exception {
        Group scene = parser.parse("<svg>"
                + "<circle r='0'/><ellipse rx='1'/><path/>"
                + "<rect width='1' height='1'/></svg>");

        assertThat(scene.contents()).extracting(node -> shape(node).form())
                                    .as("forms")
                                    .containsExactly(new Rect(0, 0, 1, 1));
        assertThat(warnings()).as("warnings").isEmpty();
        assertThat(problems).extracting(Diagnostic::element)
                            .as("fine diagnostics")
                            .containsExactly("circle", "ellipse", "path");
    }

    @Test
    void referenceChainDepth() throws Exception {
        parser = SVGParser.builder()
                .defaults(SceneDefaults.standard().withMaxReferenceDepth(2))
                .diagnostics(problems::add)
                .build();

        Group scene = resource("chain");

        assertThat(scene.contents()).extracting(node -> shape(node).form())
                                    .as("forms")
                                    .containsExactly(new Rect(0, 0, 1, 1));
        assertThat(warnings()).extracting(Diagnostic::element)
                              .as("warnings")
                              .containsExactly("use", "use");
    }

    @Test
    void initialPosition() throws Exception {
        Group scene = SVGParser.builder()
                .initialPosition(Transform.translation(3, 4))
                .build()
                .parse("<svg/>");

        assertThat(scene.place()).as("scene place")
                                 .isEqualTo(Transform.translation(3, 4));
        assertThat(scene.contents()).as("contents").isEmpty();
    }

    @Test
    void defaultFill() throws Exception {
        parser = SVGParser.builder()
                .defaults(SceneDefaults.standard().withFill(BLUE))
                .build();

        Group scene = parser.parse("<svg><rect width='1' height='1'/></svg>");

        assertThat(fillColor(scene.contents().get(0))).as("fill").isEqualTo(BLUE);
    }

    @Test
    void malformedMarkup() {
        assertThatThrownBy(() -> parser.parse("<svg><rect></svg>"))
                .isInstanceOf(MarkupException.class);
    }

    @Test
    void parseFile(@TempDir Path tempDir) throws Exception {
        Path file = tempDir.resolve("icon.svg");
        Files.write(file, "<svg><circle r='2'/></svg>".getBytes(StandardCharsets.UTF_8));

        Group scene = parser.parse(file);

        assertThat(scene.contents()).as("contents").hasSize(1);
    }

    @Test
    void missingFile(@TempDir Path tempDir) {
        assertThatThrownBy(() -> parser.parse(tempDir.resolve("missing.svg")))
                .isInstanceOf(NoSuchFileException.class);
    }

    @Test
    void missingResource() {
        assertThatThrownBy(() -> parser.parse(getClass().getClassLoader(), "missing"))
                .isInstanceOf(NoSuchFileException.class)
                .hasMessage("missing.svg");
    }

}
