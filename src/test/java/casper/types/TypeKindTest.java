package casper.types;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.not;
import static org.hamcrest.MatcherAssert.assertThat;

import org.junit.Test;

public class TypeKindTest {

    @Test
    public void equalityIsStructural() {
        assertThat(new ListType(NumType.INSTANCE), is(new ListType(NumType.INSTANCE)));
        assertThat(new ListType(NumType.INSTANCE).hashCode(), is(new ListType(NumType.INSTANCE).hashCode()));
        assertThat(new DictType(StringType.INSTANCE, new SetType(BooleanType.INSTANCE)),
            is(new DictType(StringType.INSTANCE, new SetType(BooleanType.INSTANCE))));
        assertThat(new ListType(NumType.INSTANCE), is(not(new ListType(StringType.INSTANCE))));
        assertThat((TypeKind) new ListType(NumType.INSTANCE), is(not((TypeKind) new SetType(NumType.INSTANCE))));
    }

    @Test
    public void namesFollowSourceSpelling() {
        assertThat(new DictType(StringType.INSTANCE, new ListType(NumType.INSTANCE)).getName(),
            is("dict<string, list<num>>"));
        assertThat(BooleanType.INSTANCE.toString(), is("bool"));
        assertThat(new SetType(null).getName(), is("set<?>"));
        assertThat(new DictType(null, null).getName(), is("dict<?, ?>"));
    }

    @Test
    public void emptyLiteralTypesFitAnyCollectionOfTheSameShape() {
        assertThat(new ListType(null).isAssignableTo(new ListType(StringType.INSTANCE)), is(true));
        assertThat(new DictType(null, null).isAssignableTo(new DictType(NumType.INSTANCE, NumType.INSTANCE)), is(true));
        assertThat(new ListType(null).isAssignableTo(new SetType(NumType.INSTANCE)), is(false));
        assertThat(new ListType(new ListType(null)).isAssignableTo(new ListType(new ListType(NumType.INSTANCE))),
            is(true));
    }

    @Test
    public void primitivesAreAssignableOnlyToThemselves() {
        assertThat(NumType.INSTANCE.isAssignableTo(NumType.INSTANCE), is(true));
        assertThat(NumType.INSTANCE.isAssignableTo(StringType.INSTANCE), is(false));
        assertThat(new ListType(NumType.INSTANCE).isAssignableTo(new ListType(StringType.INSTANCE)), is(false));
    }
}
