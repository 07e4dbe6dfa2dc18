package org.Aayush.wfst.algorithm;

import org.Aayush.wfst.algorithm.mapper.ProjectMapper;
import org.Aayush.wfst.fst.MutableFst;

import java.util.Objects;

/**
 * Keeps one side of a transducer, producing an acceptor in place.
 */
public final class Project {

    private Project() {
    }

    public static <W> void project(MutableFst<W> fst, ProjectType type) {
        ArcMap.map(fst, new ProjectMapper<>(Objects.requireNonNull(type, "type")));
    }
}
