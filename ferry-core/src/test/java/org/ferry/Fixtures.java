package org.ferry;

import org.ferry.model.ColumnDescriptor;
import org.ferry.model.ConstraintDescriptor;
import org.ferry.model.ConstraintType;
import org.ferry.model.GrantDescriptor;
import org.ferry.model.GrantObjectType;
import org.ferry.model.PolicyCommand;
import org.ferry.model.PolicyDescriptor;
import org.ferry.model.TableDescriptor;

import java.util.List;

/**
 * Descriptor shorthands for tests. Everything lives in {@code public} unless stated.
 */
public final class Fixtures {

    private Fixtures() {
    }

    public static TableDescriptor table(String name) {
        return TableDescriptor.builder().schema("public").name(name).build();
    }

    public static TableDescriptor rlsTable(String name) {
        return TableDescriptor.builder().schema("public").name(name).rlsEnabled(true).build();
    }

    public static ColumnDescriptor column(String table, String name, String type, int position) {
        return ColumnDescriptor.builder()
                .schema("public")
                .tableName(table)
                .name(name)
                .type(type)
                .nullable(true)
                .ordinalPosition(position)
                .build();
    }

    public static ColumnDescriptor notNullColumn(String table, String name, String type, int position) {
        return column(table, name, type, position).toBuilder().nullable(false).build();
    }

    public static ConstraintDescriptor primaryKey(String table, String column) {
        return ConstraintDescriptor.builder()
                .schema("public")
                .tableName(table)
                .name(table + "_pkey")
                .type(ConstraintType.PRIMARY_KEY)
                .definition("PRIMARY KEY (" + column + ")")
                .build();
    }

    public static PolicyDescriptor policy(String table, String name, List<String> roles, String using) {
        return PolicyDescriptor.builder()
                .schema("public")
                .tableName(table)
                .name(name)
                .command(PolicyCommand.SELECT)
                .roles(roles)
                .usingExpression(using)
                .permissive(true)
                .build();
    }

    public static GrantDescriptor tableGrant(String table, String grantee, String privilege) {
        return GrantDescriptor.builder()
                .objectType(GrantObjectType.TABLE)
                .schema("public")
                .objectName(table)
                .grantee(grantee)
                .privilege(privilege)
                .build();
    }
}
