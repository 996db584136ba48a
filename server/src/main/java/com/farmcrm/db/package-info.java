/**
 * The database layer of the farmer CRM.
 *
 * <p>Each table the application reads has a helper class with a plural name ({@code Farmers},
 * {@code Fields}, {@code Messages}, {@code CropTechnology}) whose static methods take an open
 * {@link java.sql.Connection}, run one parameterized statement and map the rows to a record. Helpers
 * never throw {@link java.sql.SQLException}; failures come back as a {@code StatusOr} classified by
 * {@link com.farmcrm.db.util.DbUtil#toStatus}.
 *
 * <p>Columns the records expose but the schema does not store are filled from {@link
 * com.farmcrm.db.UnmodeledFields}.
 */
package com.farmcrm.db;
