package com.luauprinter.cst;

import com.luauprinter.InternalConsistencyException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

final class CstLists {

    private CstLists() {
    }

    /**
     * Copies a position list. Entries may be null (an argument without an
     * annotation has no colon), the list itself may not.
     */
    static <T> List<T> copy(List<T> list, String what) {
        if (list == null) {
            throw new InternalConsistencyException(what + " must not be null");
        }
        return Collections.unmodifiableList(new ArrayList<>(list));
    }
}
