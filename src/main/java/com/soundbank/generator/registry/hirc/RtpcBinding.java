package com.soundbank.generator.registry.hirc;

import java.util.ArrayList;
import java.util.List;

import com.soundbank.generator.model.SourceNode;
import com.soundbank.generator.render.state.ParamValue;

import lombok.Value;

/**
 * A real-time parameter curve driving an object's volume. Curve points double as the
 * parameter's buckets.
 */
@Value
public class RtpcBinding {

    long paramId;
    String paramName;
    List<Point> points;

    @Value
    public static class Point {
        double x;
        double y;
    }

    public List<ParamValue> toParamValues() {
        return points.stream()
                .map(point -> ParamValue.of(paramId, point.getX(), paramName))
                .toList();
    }

    /**
     * Volume at {@code x}, linearly interpolated and clamped to the curve ends.
     */
    public double volumeAt(double x) {
        if (points.isEmpty()) {
            return 0;
        }
        Point first = points.get(0);
        if (x <= first.getX()) {
            return first.getY();
        }
        for (int i = 1; i < points.size(); i++) {
            Point prev = points.get(i - 1);
            Point next = points.get(i);
            if (x <= next.getX()) {
                double span = next.getX() - prev.getX();
                if (span == 0) {
                    return next.getY();
                }
                return prev.getY() + (next.getY() - prev.getY()) * (x - prev.getX()) / span;
            }
        }
        return points.get(points.size() - 1).getY();
    }

    static RtpcBinding parse(HircObject owner, SourceNode rtpc) {
        SourceNode idField = owner.required(rtpc, "rtpcID");
        List<Point> points = new ArrayList<>();
        for (SourceNode point : owner.list(rtpc, "points")) {
            points.add(new Point(owner.number(owner.required(point, "x")), owner.number(owner.required(point, "y"))));
        }
        points.sort((a, b) -> Double.compare(a.getX(), b.getX()));
        return new RtpcBinding(owner.integer(idField), idField.getHashName().orElse(null), List.copyOf(points));
    }
}
