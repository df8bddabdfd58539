package com.availspec.compiler.syntax;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

/**
 * 有序参数列表。属性形式中第一个元素总是平台。
 */
public final class AvailabilityArgumentListSyntax extends Syntax implements Iterable<AvailabilityArgumentSyntax> {

    AvailabilityArgumentListSyntax(SyntaxArena arena, int id) {
        super(arena, id);
    }

    public static AvailabilityArgumentListSyntax create(SyntaxArena arena, List<AvailabilityArgumentSyntax> elements) {
        List<Integer> ids = new ArrayList<Integer>(elements.size());
        for (AvailabilityArgumentSyntax element : elements) {
            ids.add(idOf(arena, element));
        }
        return new AvailabilityArgumentListSyntax(arena,
                arena.record(RawSyntax.collection(SyntaxKind.AVAILABILITY_ARGUMENT_LIST, ids)));
    }

    public int size() {
        return getRaw().getChildCount();
    }

    public boolean isEmpty() {
        return size() == 0;
    }

    public AvailabilityArgumentSyntax get(int index) {
        return new AvailabilityArgumentSyntax(arena, getRaw().getChild(index));
    }

    public List<AvailabilityArgumentSyntax> getElements() {
        List<AvailabilityArgumentSyntax> elements = new ArrayList<AvailabilityArgumentSyntax>(size());
        for (int i = 0; i < size(); i++) {
            elements.add(get(i));
        }
        return elements;
    }

    @Override
    public Iterator<AvailabilityArgumentSyntax> iterator() {
        return getElements().iterator();
    }

    @Override
    public <R, C> R accept(SyntaxVisitor<R, C> visitor, C context) {
        return visitor.visitAvailabilityArgumentList(this, context);
    }
}
